package org.pragmatica.unionize.rewrite;

import org.pragmatica.unionize.parser.PyNode;
import org.pragmatica.unionize.parser.PyNode.Alias;
import org.pragmatica.unionize.parser.PyNode.Attribute;
import org.pragmatica.unionize.parser.PyNode.Import;
import org.pragmatica.unionize.parser.PyNode.ImportFrom;
import org.pragmatica.unionize.parser.PyNode.Name;
import org.pragmatica.unionize.parser.PyNodes;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Names a file binds to the wrapper constructs and to the modules that define them.
 * <p>
 * Built from all import statements of a file before the pattern walk, so that aliases such as
 * {@code from typing import Optional as Opt} or {@code import typing as t} resolve at every usage
 * site, including inside fragments handed to the sub-transformer.
 */
public final class ImportBindings {
    private final RewriteConfig config;
    private final Map<String, WrapperKind> memberAliases;
    private final Map<String, String> moduleAliases;
    private final Set<String> shadowed;

    private ImportBindings(RewriteConfig config,
                           Map<String, WrapperKind> memberAliases,
                           Map<String, String> moduleAliases,
                           Set<String> shadowed) {
        this.config = config;
        this.memberAliases = Map.copyOf(memberAliases);
        this.moduleAliases = Map.copyOf(moduleAliases);
        this.shadowed = Set.copyOf(shadowed);
    }

    public static ImportBindings importBindings(PyNode root, RewriteConfig config) {
        var memberAliases = new HashMap<String, WrapperKind>();
        var moduleAliases = new HashMap<String, String>();
        var shadowed = new HashSet<String>();
        for (var statement : PyNodes.findAll(root, ImportFrom.class)) {
            for (var alias : statement.names()) {
                var kind = wrapperMember(statement, alias, config);
                if (kind.isPresent()) {
                    memberAliases.put(alias.localName(), kind.get());
                } else {
                    shadowed.add(alias.localName());
                }
            }
        }
        for (var statement : PyNodes.findAll(root, Import.class)) {
            for (var alias : statement.names()) {
                var module = alias.asName()
                                  .isPresent()
                             ? alias.name()
                             : alias.localName();
                if (config.isWrapperModule(module)) {
                    moduleAliases.put(alias.localName(), module);
                }
            }
        }
        shadowed.removeAll(memberAliases.keySet());
        return new ImportBindings(config, memberAliases, moduleAliases, shadowed);
    }

    /**
     * The wrapper a member import introduces, if it is {@code from <wrapper module> import Optional/Union}.
     */
    public static Optional<WrapperKind> wrapperMember(ImportFrom statement, Alias alias, RewriteConfig config) {
        if (statement.level() != 0 || !config.isWrapperModule(statement.module())) {
            return Optional.empty();
        }
        return WrapperKind.byName(alias.name());
    }

    public RewriteConfig config() {
        return config;
    }

    /**
     * Wrapper a plain name refers to. Imported aliases win; the canonical names count unless the file
     * imports them from somewhere else.
     */
    public Optional<WrapperKind> resolveName(String id) {
        var aliased = memberAliases.get(id);
        if (aliased != null) {
            return Optional.of(aliased);
        }
        if (shadowed.contains(id)) {
            return Optional.empty();
        }
        return WrapperKind.byName(id);
    }

    /**
     * Whether {@code id} is bound to one of the wrapper modules by an {@code import} statement.
     */
    public boolean isModuleAlias(String id) {
        return moduleAliases.containsKey(id);
    }

    /**
     * Resolve the head of a subscript or a bare reference: {@code Optional}, {@code Opt} or {@code typing.Optional}.
     */
    public Optional<WrapperHead> resolveHead(PyNode head) {
        if (head instanceof Name name) {
            return resolveName(name.id()).map(kind -> new WrapperHead(kind, Optional.empty()));
        }
        if (head instanceof Attribute attribute) {
            var kind = WrapperKind.byName(attribute.attr());
            var module = PyNodes.dottedName(attribute.value());
            if (kind.isEmpty() || module.isEmpty() || !isWrapperModuleReference(module.get())) {
                return Optional.empty();
            }
            return Optional.of(new WrapperHead(kind.get(),
                                               PyNodes.rootName(attribute.value())
                                                      .map(Name::id)));
        }
        return Optional.empty();
    }

    private boolean isWrapperModuleReference(String dottedName) {
        return moduleAliases.containsKey(dottedName) || config.isWrapperModule(dottedName);
    }

    /**
     * Resolved wrapper head. {@code module} is the local name the head is accessed through, if any.
     */
    public record WrapperHead(WrapperKind kind, Optional<String> module) {}
}
