package org.rostilos.prwizard.pipelineagent.generic.command;

import java.util.Objects;

/**
 * @param code uppercase annotation code for {@link CommandType#ACCEPT} and {@link CommandType#REJECT},
 *             null for {@link CommandType#WIZARD_REVIEW}
 */
public record ParsedCommand(CommandType type, String code) {

    public ParsedCommand {
        Objects.requireNonNull(type, "type");
        if (type.isDecision() && code == null) {
            throw new IllegalArgumentException(type + " requires a code");
        }
    }

    public static ParsedCommand accept(String code) {
        return new ParsedCommand(CommandType.ACCEPT, code);
    }

    public static ParsedCommand reject(String code) {
        return new ParsedCommand(CommandType.REJECT, code);
    }

    public static ParsedCommand wizardReview() {
        return new ParsedCommand(CommandType.WIZARD_REVIEW, null);
    }
}
