package com.dogfold.scaffold.codegen.template;

import java.nio.file.Path;
import java.util.List;

import lombok.NonNull;
import lombok.Value;

/**
 * A located template: the candidates in precedence order (most specific first) and the one chosen.
 */
@Value
public class TemplateReference {

    @NonNull
    List<Path> candidates;

    @NonNull
    Path path;

    public boolean isFallback() {
        return !candidates.get(0).equals(path);
    }
}
