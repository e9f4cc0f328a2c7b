package org.pragmatica.unionize.rewrite;

import java.util.Arrays;
import java.util.Optional;

/**
 * The two deprecated typing constructs the rewriter replaces.
 */
public enum WrapperKind {
    /** {@code Optional[T]}, becomes {@code T | None}. */
    NULLABLE("Optional"),
    /** {@code Union[A, B]}, becomes {@code A | B}. */
    UNION("Union");

    private final String typingName;

    WrapperKind(String typingName) {
        this.typingName = typingName;
    }

    public String typingName() {
        return typingName;
    }

    public static Optional<WrapperKind> byName(String name) {
        return Arrays.stream(values())
                     .filter(kind -> kind.typingName.equals(name))
                     .findFirst();
    }
}
