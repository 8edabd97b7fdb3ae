package com.dogfold.scaffold.codegen.model;

import com.dogfold.scaffold.codegen.exception.InvalidNameException;
import com.dogfold.scaffold.codegen.util.NamingUtil;

import lombok.NonNull;
import lombok.Value;

/**
 * A verb name, optionally qualified by its domain ({@code domain.verb}).
 */
@Value
public class VerbName {

    /**
     * Domain of the verb, {@code null} for top-level verbs.
     */
    String domain;

    @NonNull
    String verb;

    /**
     * Parses {@code verb} or {@code domain.verb}.
     *
     * @throws InvalidNameException if a dotted name does not split into exactly two non-empty parts
     */
    public static VerbName parse(String fullName) {
        if (fullName == null || fullName.isBlank()) {
            throw new InvalidNameException("Verb name must not be blank");
        }
        if (!fullName.contains(".")) {
            return new VerbName(null, NamingUtil.requireSimpleName("Verb", fullName));
        }
        String[] parts = fullName.split("\\.", -1);
        if (parts.length != 2 || parts[0].isBlank() || parts[1].isBlank()) {
            throw new InvalidNameException("Invalid domain.verb name: " + fullName);
        }
        return new VerbName(NamingUtil.requireSimpleName("Domain", parts[0]),
                NamingUtil.requireSimpleName("Verb", parts[1]));
    }

    public boolean hasDomain() {
        return domain != null;
    }

    /**
     * Title-cased verb name followed by {@code Verb}, e.g. {@code InvoiceVerb}.
     */
    public String typeName() {
        return NamingUtil.toTypeName(verb) + "Verb";
    }

    public String qualifiedName() {
        return hasDomain() ? domain + "." + verb : verb;
    }

    @Override
    public String toString() {
        return qualifiedName();
    }
}
