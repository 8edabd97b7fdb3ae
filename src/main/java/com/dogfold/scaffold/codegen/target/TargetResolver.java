package com.dogfold.scaffold.codegen.target;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

import com.dogfold.scaffold.codegen.config.ScaffoldConfig;
import com.dogfold.scaffold.codegen.exception.UnknownTargetException;

/**
 * Resolves target selectors to discovered {@link Target}s.
 *
 * Targets are discovered once, when the resolver is created, and are read-only afterwards.
 */
public class TargetResolver {

    public static final String TARGET_OPTION = "--target";
    public static final String SELF_OPTION = "--self";

    private final Map<String, Target> targets;
    private final AliasTable aliases;

    public TargetResolver(Map<String, Target> targets, AliasTable aliases) {
        this.targets = Collections.unmodifiableMap(new LinkedHashMap<>(targets));
        this.aliases = aliases;
    }

    /**
     * Discovers the targets of a repository.
     *
     * @param repoRoot repository root the configured locations are relative to
     * @param config probe locations, aliases and default target
     */
    public static TargetResolver discover(Path repoRoot, ScaffoldConfig config) {
        Map<String, Target> discovered = new TargetDiscoveryService().discover(repoRoot, config);
        AliasTable aliasTable = new AliasTable(config.defaultTarget().key(), config.aliases());
        return new TargetResolver(discovered, aliasTable);
    }

    /**
     * Resolves a selector (case-insensitive, aliases applied, null for the default target).
     *
     * @throws UnknownTargetException if no discovered target matches
     */
    public Target resolve(String selector) {
        String key = aliases.canonicalKey(selector);
        Target target = targets.get(key);
        if (target == null) {
            throw new UnknownTargetException(selector, listTargets());
        }
        return target;
    }

    /**
     * Extracts a {@code --target <name>} pair or a {@code --self} flag from a flat argument list.
     * {@code --self} selects the default target unless an explicit target was already given.
     * The target name is not validated here.
     */
    public TargetSelection parseTargetSelector(List<String> args) {
        String target = null;
        List<String> remaining = new ArrayList<>();
        int i = 0;
        while (i < args.size()) {
            String token = args.get(i);
            if (TARGET_OPTION.equals(token) && i + 1 < args.size()) {
                target = args.get(i + 1);
                i += 2;
                continue;
            }
            if (SELF_OPTION.equals(token)) {
                if (target == null) {
                    target = aliases.getDefaultTarget();
                }
                i++;
                continue;
            }
            remaining.add(token);
            i++;
        }
        return new TargetSelection(target, List.copyOf(remaining));
    }

    public SortedSet<String> listTargets() {
        return Collections.unmodifiableSortedSet(new TreeSet<>(targets.keySet()));
    }

    public String getDefaultTarget() {
        return aliases.getDefaultTarget();
    }

    public Map<String, Target> getTargets() {
        return targets;
    }
}
