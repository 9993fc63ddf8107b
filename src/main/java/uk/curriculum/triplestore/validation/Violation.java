package uk.curriculum.triplestore.validation;

public record Violation(String focusNode,
                        String path,
                        String value,
                        String severity,
                        String message,
                        String component) {
}
