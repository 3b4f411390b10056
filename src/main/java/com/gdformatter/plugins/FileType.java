package com.gdformatter.plugins;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

import com.gdformatter.util.LoggerUtil;

/**
 * File types the formatter knows about, detected by extension.
 */
public enum FileType {
    GDSCRIPT("gd"),
    UNKNOWN("");

    private static final Logger logger = LoggerUtil.getLogger(FileType.class);
    private static final Map<Path, FileType> typeCache = new ConcurrentHashMap<>();
    private static final int MAX_CACHE_SIZE = 10000;

    private final String extension;

    FileType(String extension) {
        this.extension = extension;
    }

    /**
     * Detects the type of {@code filePath}. Results are cached per path.
     */
    public static FileType detect(Path filePath) {
        if (filePath == null || filePath.getFileName() == null) {
            return UNKNOWN;
        }
        FileType cachedType = typeCache.get(filePath);
        if (cachedType != null) {
            return cachedType;
        }

        if (typeCache.size() > MAX_CACHE_SIZE) {
            typeCache.clear();
            logger.fine("Cleared file type detection cache");
        }

        FileType type = _detectByExtension(filePath);
        typeCache.put(filePath, type);
        return type;
    }

    private static FileType _detectByExtension(Path filePath) {
        String fileName = filePath.getFileName().toString().toLowerCase(Locale.ROOT);
        int dot = fileName.lastIndexOf('.');
        if (dot < 0) {
            return UNKNOWN;
        }
        String extension = fileName.substring(dot + 1);
        for (FileType type : values()) {
            if (type != UNKNOWN && type.extension.equals(extension)) {
                return type;
            }
        }
        return UNKNOWN;
    }

    public String getDescription() {
        return switch (this) {
            case GDSCRIPT -> "GDScript source file";
            case UNKNOWN -> "Unknown file type";
        };
    }
}
