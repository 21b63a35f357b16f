package com.example.progress.shared.dto;

import com.example.progress.shared.util.Constants.CommandType;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * An inbound client message after decoding. {@code raw} always holds the text exactly as
 * received so that unrecognized input can be echoed back verbatim.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ClientCommand {

    CommandType type;
    String declaredType;
    String workflowId;
    String raw;

    public static ClientCommand structured(String declaredType, String workflowId, String raw) {
        CommandType type = CommandType.fromWire(declaredType);
        if (type == CommandType.SUBSCRIBE && (workflowId == null || workflowId.isBlank())) {
            type = CommandType.UNRECOGNIZED;
        }
        return new ClientCommand(type, declaredType, workflowId, raw);
    }

    public static ClientCommand plainText(String raw) {
        return new ClientCommand(CommandType.PLAIN_TEXT, null, null, raw == null ? "" : raw);
    }
}
