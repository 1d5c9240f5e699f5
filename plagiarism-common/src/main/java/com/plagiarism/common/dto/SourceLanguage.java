package com.plagiarism.common.dto;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * 源代码语言：8051 汇编或 C。
 */
public enum SourceLanguage {

    ASSEMBLY(Set.of(".a51", ".asm", ".src")),
    C(Set.of(".c"));

    private final Set<String> extensions;

    SourceLanguage(Set<String> extensions) {
        this.extensions = extensions;
    }

    public Set<String> getExtensions() {
        return extensions;
    }

    /**
     * 按文件扩展名（含点号，大小写不敏感）识别语言。
     */
    public static Optional<SourceLanguage> fromExtension(String extension) {
        if (extension == null) {
            return Optional.empty();
        }
        String ext = extension.toLowerCase(Locale.ROOT);
        for (SourceLanguage language : values()) {
            if (language.extensions.contains(ext)) {
                return Optional.of(language);
            }
        }
        return Optional.empty();
    }
}
