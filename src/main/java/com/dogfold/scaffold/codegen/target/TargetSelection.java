package com.dogfold.scaffold.codegen.target;

import java.util.List;

import lombok.Value;

/**
 * Result of extracting {@code --target}/{@code --self} from an argument list.
 */
@Value
public class TargetSelection {

    /**
     * Selected target name, or {@code null} when no selector was given.
     */
    String targetName;

    List<String> remainingArgs;
}
