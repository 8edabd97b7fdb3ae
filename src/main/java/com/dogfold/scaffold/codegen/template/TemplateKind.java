package com.dogfold.scaffold.codegen.template;

import java.util.EnumSet;
import java.util.Set;

/**
 * Template families and the placeholders each one may use.
 */
public enum TemplateKind {

    VERB(EnumSet.of(Placeholder.VERB_NAME, Placeholder.VERB_TYPE_NAME, Placeholder.DOMAIN_NAME)),
    CLASS(EnumSet.of(Placeholder.CLASS_NAME, Placeholder.DOMAIN_NAME)),
    DOMAIN_COMMANDS(EnumSet.of(Placeholder.DOMAIN_NAME)),
    CLI(EnumSet.noneOf(Placeholder.class));

    private final Set<Placeholder> allowed;

    TemplateKind(Set<Placeholder> allowed) {
        this.allowed = allowed;
    }

    public boolean allows(String token) {
        return allowed.stream().anyMatch(p -> p.getToken().equals(token));
    }
}
