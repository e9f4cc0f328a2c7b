package org.pragmatica.unionize.rewrite;

import java.util.EnumSet;
import java.util.HashSet;
import java.util.Set;

/**
 * Per-pass record of which imports must survive.
 * <p>
 * Holds the wrapper kinds still referenced after this pass, the wrapper module aliases still
 * referenced, and the module aliases through which at least one usage was rewritten.
 */
public final class RetentionSet {
    private final Set<WrapperKind> kinds = EnumSet.noneOf(WrapperKind.class);
    private final Set<String> modules = new HashSet<>();
    private final Set<String> rewrittenModules = new HashSet<>();

    private RetentionSet() {}

    public static RetentionSet retentionSet() {
        return new RetentionSet();
    }

    public void retain(WrapperKind kind) {
        kinds.add(kind);
    }

    public void retainModule(String alias) {
        modules.add(alias);
    }

    public void rewrittenThrough(String alias) {
        rewrittenModules.add(alias);
    }

    public boolean isRetained(WrapperKind kind) {
        return kinds.contains(kind);
    }

    public boolean isModuleRetained(String alias) {
        return modules.contains(alias);
    }

    public boolean wasRewrittenThrough(String alias) {
        return rewrittenModules.contains(alias);
    }

    public Set<WrapperKind> kinds() {
        return Set.copyOf(kinds);
    }

    public Set<String> rewrittenModules() {
        return Set.copyOf(rewrittenModules);
    }

    public void mergeFrom(RetentionSet other) {
        kinds.addAll(other.kinds);
        modules.addAll(other.modules);
        rewrittenModules.addAll(other.rewrittenModules);
    }

    @Override
    public String toString() {
        return "RetentionSet" + kinds + modules;
    }
}
