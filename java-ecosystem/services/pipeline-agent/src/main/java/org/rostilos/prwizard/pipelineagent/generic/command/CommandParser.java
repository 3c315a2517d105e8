package org.rostilos.prwizard.pipelineagent.generic.command;

import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognizes reviewer commands in comment text.
 * <p>
 * A decision command must be the whole comment: {@code /accept CODE} or {@code /reject CODE},
 * case-insensitive, with a six character alphanumeric code. {@code /wizard-review} may be
 * followed by free text. Anything else is ordinary feedback.
 */
@Component
public class CommandParser {

    private static final Pattern DECISION = Pattern.compile("^/(accept|reject)\\s+([A-Z0-9]{6})$",
            Pattern.CASE_INSENSITIVE);

    private static final String WIZARD_REVIEW = "/wizard-review";

    public Optional<ParsedCommand> parse(String commentText) {
        if (commentText == null) {
            return Optional.empty();
        }
        String trimmed = commentText.trim();

        Matcher matcher = DECISION.matcher(trimmed);
        if (matcher.matches()) {
            String code = matcher.group(2).toUpperCase(Locale.ROOT);
            return Optional.of("accept".equalsIgnoreCase(matcher.group(1))
                    ? ParsedCommand.accept(code)
                    : ParsedCommand.reject(code));
        }

        if (isWizardReview(trimmed)) {
            return Optional.of(ParsedCommand.wizardReview());
        }
        return Optional.empty();
    }

    private boolean isWizardReview(String trimmed) {
        if (trimmed.equals(WIZARD_REVIEW)) {
            return true;
        }
        return trimmed.length() > WIZARD_REVIEW.length()
                && trimmed.startsWith(WIZARD_REVIEW)
                && Character.isWhitespace(trimmed.charAt(WIZARD_REVIEW.length()));
    }
}
