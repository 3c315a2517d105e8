package org.rostilos.prwizard.pipelineagent.generic.annotation;

import org.rostilos.prwizard.core.model.annotation.PendingAnnotation;
import org.springframework.stereotype.Component;

import java.util.random.RandomGenerator;

/**
 * Draws six character codes from {@code A-Z0-9}. Uniqueness is not checked here; the store's
 * primary key decides whether a drawn code is free.
 */
@Component
public class AnnotationCodeGenerator {

    static final String ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";

    private final RandomGenerator random;

    public AnnotationCodeGenerator(RandomGenerator random) {
        this.random = random;
    }

    public String nextCode() {
        char[] code = new char[PendingAnnotation.CODE_LENGTH];
        for (int i = 0; i < code.length; i++) {
            code[i] = ALPHABET.charAt(random.nextInt(ALPHABET.length()));
        }
        return new String(code);
    }
}
