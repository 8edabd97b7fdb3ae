package com.dogfold.scaffold.codegen.template;

/**
 * Closed set of tokens recognized in target templates.
 */
public enum Placeholder {

    CLASS_NAME("{CLASS_NAME}"),
    VERB_NAME("{VERB_NAME}"),
    DOMAIN_NAME("{DOMAIN_NAME}"),

    /**
     * Type name of a generated verb: the title-cased verb name followed by {@code Verb}.
     */
    VERB_TYPE_NAME("VerbNameVerb");

    private final String token;

    Placeholder(String token) {
        this.token = token;
    }

    public String getToken() {
        return token;
    }
}
