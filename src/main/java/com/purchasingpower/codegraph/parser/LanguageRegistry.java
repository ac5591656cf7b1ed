package com.purchasingpower.codegraph.parser;

import java.nio.file.Path;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Maps file extensions to {@link FileType}s.
 */
public final class LanguageRegistry {

    private static final Map<String, FileType> BY_EXTENSION;

    static {
        Map<String, FileType> map = new HashMap<>();
        for (FileType type : FileType.values()) {
            for (String extension : type.getExtensions()) {
                map.put(extension, type);
            }
        }
        BY_EXTENSION = Collections.unmodifiableMap(map);
    }

    private LanguageRegistry() {
    }

    /**
     * Category of a file, decided by its last extension (case-sensitive).
     */
    public static FileType fileTypeOf(Path file) {
        String name = file.getFileName() == null ? "" : file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        // dotfiles such as ".bashrc" have no extension
        if (dot <= 0) {
            return FileType.UNSUPPORTED;
        }
        return BY_EXTENSION.getOrDefault(name.substring(dot), FileType.UNSUPPORTED);
    }

    /**
     * Whether the file can be parsed into an AST.
     */
    public static boolean supportsFile(Path file) {
        return fileTypeOf(file).hasGrammar();
    }

    /**
     * Whether the file is handled by the document chunker.
     */
    public static boolean isTextFile(Path file) {
        return fileTypeOf(file) == FileType.TEXT;
    }
}
