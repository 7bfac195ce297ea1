package com.github.rmannibucau.asciidoctor.adf;

import static java.nio.charset.StandardCharsets.UTF_8;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;

import org.asciidoctor.Asciidoctor;
import org.asciidoctor.Options;
import org.asciidoctor.SafeMode;

import com.github.rmannibucau.asciidoctor.adf.reverse.AdfToAsciidocConverter;

/**
 * Converts one file: {@code .adf}/{@code .json} to AsciiDoc, anything else to ADF.
 */
public class AdfService {
    public static void main(final String[] args) throws IOException {
        if (args.length != 1) {
            throw new IllegalArgumentException("Usage: AdfService <file.adoc|file.adf|file.json>");
        }
        System.out.println(convert(new File(args[0])));
    }

    static String convert(final File file) throws IOException {
        final String content = Files.readString(file.toPath(), UTF_8);
        final String name = file.getName();
        if (name.endsWith(".adf") || name.endsWith(".json")) {
            return new AdfToAsciidocConverter().convert(content);
        }
        try (final Asciidoctor asciidoctor = Asciidoctor.Factory.create()) {
            return asciidoctor.convert(content, Options.builder()
                    .toFile(false)
                    .backend(AdfConverter.BACKEND)
                    .safe(SafeMode.SAFE)
                    .baseDir(file.getAbsoluteFile().getParentFile())
                    .build());
        }
    }
}
