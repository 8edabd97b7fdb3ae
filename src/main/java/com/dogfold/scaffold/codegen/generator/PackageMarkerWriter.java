package com.dogfold.scaffold.codegen.generator;

import java.io.IOException;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.dogfold.scaffold.codegen.config.ScaffoldConfig;
import com.dogfold.scaffold.codegen.target.Target;
import com.dogfold.scaffold.codegen.util.FileWriteUtil;

/**
 * Creates the marker file that makes a generated directory a package.
 *
 * For {@code package-info.java} markers the content is a package declaration derived from the
 * directory's position under the target root; other marker names get a comment line.
 */
public class PackageMarkerWriter {

    private static final Logger log = LoggerFactory.getLogger(PackageMarkerWriter.class);

    private final ScaffoldConfig config;

    public PackageMarkerWriter(ScaffoldConfig config) {
        this.config = config;
    }

    /**
     * Creates the directory and its marker if they are missing.
     *
     * @return {@code true} if the marker was created
     */
    public boolean ensure(Target target, Path dir, String description) throws IOException {
        FileWriteUtil.createDirectories(dir);
        Path marker = markerOf(dir);
        boolean created = FileWriteUtil.writeIfAbsent(marker, content(target, dir, description));
        if (created) {
            log.debug("Created package marker {}", marker);
        }
        return created;
    }

    public Path markerOf(Path dir) {
        return dir.resolve(config.packageMarker());
    }

    private String content(Target target, Path dir, String description) {
        String packageName = target.javaPackageOf(dir);
        if (config.packageMarker().endsWith(".java")) {
            String doc = description == null || description.isBlank() ? "" : "/** " + description + " */\n";
            return doc + "package " + packageName + ";\n";
        }
        return description == null || description.isBlank() ? "" : "# " + description + "\n";
    }
}
