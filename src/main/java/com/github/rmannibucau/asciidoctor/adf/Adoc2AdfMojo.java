package com.github.rmannibucau.asciidoctor.adf;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;
import static java.util.Locale.ROOT;
import static java.util.Optional.ofNullable;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.zip.GZIPOutputStream;

import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveOutputStream;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipArchiveOutputStream;
import org.apache.maven.plugin.AbstractMojo;
import org.apache.maven.plugin.MojoExecutionException;
import org.apache.maven.plugins.annotations.Component;
import org.apache.maven.plugins.annotations.LifecyclePhase;
import org.apache.maven.plugins.annotations.Mojo;
import org.apache.maven.plugins.annotations.Parameter;
import org.apache.maven.project.MavenProject;
import org.apache.maven.project.MavenProjectHelper;
import org.asciidoctor.Asciidoctor;
import org.asciidoctor.Attributes;
import org.asciidoctor.Options;
import org.asciidoctor.SafeMode;

import com.fasterxml.jackson.databind.ObjectMapper;

@Mojo(defaultPhase = LifecyclePhase.GENERATE_RESOURCES, name = "adoc2adf", threadSafe = true)
public class Adoc2AdfMojo extends AbstractMojo {

    @Parameter(property = "adoc2adf.sources")
    private Collection<File> sources;

    @Parameter(property = "adoc2adf.target")
    private File target;

    @Parameter(property = "adoc2adf.images")
    private File images;

    @Parameter(property = "adoc2adf.excludes")
    private Collection<String> excludes;

    @Parameter(property = "adoc2adf.format", defaultValue = "true")
    private boolean format;

    @Parameter(property = "adoc2adf.formats", defaultValue = "zip")
    private Collection<String> formats;

    @Parameter(property = "adoc2adf.classifier")
    private String classifier;

    @Parameter(property = "adoc2adf.attach", defaultValue = "true")
    private boolean attach;

    @Parameter(defaultValue = "${project.build.directory}", readonly = true)
    private File buildDirectory;

    @Parameter(defaultValue = "${project.artifactId}", readonly = true)
    private String artifactId;

    @Parameter(defaultValue = "${project}", readonly = true)
    private MavenProject project;

    @Component
    private MavenProjectHelper projectHelper;

    @Parameter
    private Map<String, String> attributes;

    @Override
    public void execute() throws MojoExecutionException {
        if (sources == null || sources.isEmpty() || sources.stream().anyMatch(s -> !s.exists())) {
            throw new MojoExecutionException("at least one source (" + sources + ") doesnt exist");
        }
        final long sourceDirectories = sources.stream().filter(File::isDirectory).count();
        if (sourceDirectories != sources.size() && sourceDirectories > 0) {
            throw new MojoExecutionException("All sources or none must be a directory, don't mix files and directories please");
        }
        if (target == null) {
            throw new MojoExecutionException("No target configured");
        }
        final boolean fromDirectory = sourceDirectories == sources.size();

        final ObjectMapper mapper = new ObjectMapper();
        int written = 0;
        try (final Asciidoctor asciidoctor = Asciidoctor.Factory.create()) {
            for (final File source : sources) {
                final List<File> files = fromDirectory
                        ? Stream.of(Objects.requireNonNull(source.listFiles((dir, name) -> isAdoc(name)))).sorted().collect(Collectors.toList())
                        : List.of(source);
                for (final File from : files) {
                    final File outputFile = fromDirectory ? new File(target, toAdfName(from.getName())) : target;
                    write(outputFile, convert(asciidoctor, mapper, from));
                    written++;
                }
            }
        }

        if (images != null && images.isDirectory() && fromDirectory) {
            copyImages();
        }

        if (written > 0 && fromDirectory && formats != null) {
            final Path prefix = target.toPath().toAbsolutePath();
            formats.forEach(format -> {
                getLog().info(format + "-ing adf documents");

                final File output = new File(buildDirectory, artifactId + "-adf-bundle." + format);
                output.getParentFile().mkdirs();

                switch (format.toLowerCase(ROOT)) {
                case "tar.gz":
                    try (final TarArchiveOutputStream tarGz = new TarArchiveOutputStream(
                            new GZIPOutputStream(new FileOutputStream(output)))) {
                        tarGz.setLongFileMode(TarArchiveOutputStream.LONGFILE_GNU);
                        for (final String entry : Objects.requireNonNull(target.list())) {
                            tarGz(tarGz, new File(target, entry), prefix);
                        }
                    } catch (final IOException e) {
                        throw new IllegalStateException(e.getMessage(), e);
                    }
                    break;
                case "zip":
                    try (final ZipArchiveOutputStream zos = new ZipArchiveOutputStream(new FileOutputStream(output))) {
                        for (final String entry : Objects.requireNonNull(target.list())) {
                            zip(zos, new File(target, entry), prefix);
                        }
                    } catch (final IOException e) {
                        throw new IllegalStateException(e.getMessage(), e);
                    }
                    break;
                default:
                    throw new IllegalArgumentException(format + " is not supported");
                }

                attach(format, output);
            });
        } else if (!fromDirectory && formats != null && !formats.isEmpty()) {
            getLog().warn("You can't bundle a single file, move source/target to directories");
        }
    }

    private String convert(final Asciidoctor asciidoctor, final ObjectMapper mapper, final File from) {
        final Attributes attributes = Attributes.builder().build();
        ofNullable(this.attributes).ifPresent(attrs -> attrs.forEach(attributes::setAttribute));
        final Options options = Options.builder()
                .toFile(false)
                .backend(AdfConverter.BACKEND)
                .safe(SafeMode.SAFE)
                .baseDir(from.getAbsoluteFile().getParentFile())
                .attributes(attributes)
                .build();
        try {
            final String adf = asciidoctor.convert(Files.readString(from.toPath(), UTF_8), options);
            return format ? mapper.writerWithDefaultPrettyPrinter().writeValueAsString(mapper.readTree(adf)) : adf;
        } catch (final IOException e) {
            throw new IllegalStateException("Can't convert " + from, e);
        }
    }

    private void write(final File outputFile, final String content) {
        outputFile.getAbsoluteFile().getParentFile().mkdirs();
        try {
            Files.writeString(outputFile.toPath(), content, UTF_8);
        } catch (final IOException e) {
            throw new IllegalStateException(e);
        }
        getLog().info("Write " + outputFile);
    }

    private void copyImages() {
        final Path root = images.toPath();
        try (final Stream<Path> files = Files.walk(root)) {
            files.filter(Files::isRegularFile).filter(p -> isBundled(p.toFile())).forEach(image -> {
                final Path copy = target.toPath().resolve(root.relativize(image).toString());
                try {
                    Files.createDirectories(copy.getParent());
                    Files.copy(image, copy, REPLACE_EXISTING);
                } catch (final IOException e) {
                    throw new IllegalStateException(e);
                }
            });
        } catch (final IOException e) {
            throw new IllegalStateException(e);
        }
    }

    private boolean isAdoc(final String name) {
        return !name.startsWith(".") && name.endsWith(".adoc") && (excludes == null || !excludes.contains(name));
    }

    private static String toAdfName(final String name) {
        return name.substring(0, name.length() - ".adoc".length()) + ".adf";
    }

    private void tarGz(final TarArchiveOutputStream tarGz, final File f, final Path prefix) throws IOException {
        if (!f.isDirectory() && !isBundled(f)) {
            return;
        }
        final String path = prefix.relativize(f.toPath().toAbsolutePath()).toString().replace(File.separator, "/");
        tarGz.putArchiveEntry(new TarArchiveEntry(f, path));
        if (f.isDirectory()) {
            tarGz.closeArchiveEntry();
            final File[] files = f.listFiles();
            if (files != null) {
                for (final File child : files) {
                    tarGz(tarGz, child, prefix);
                }
            }
        } else {
            Files.copy(f.toPath(), tarGz);
            tarGz.closeArchiveEntry();
        }
    }

    private void zip(final ZipArchiveOutputStream zip, final File f, final Path prefix) throws IOException {
        if (!f.isDirectory() && !isBundled(f)) {
            return;
        }
        final String path = prefix.relativize(f.toPath().toAbsolutePath()).toString().replace(File.separator, "/");
        zip.putArchiveEntry(new ZipArchiveEntry(f, path));
        if (f.isDirectory()) {
            zip.closeArchiveEntry();
            final File[] files = f.listFiles();
            if (files != null) {
                for (final File child : files) {
                    zip(zip, child, prefix);
                }
            }
        } else {
            Files.copy(f.toPath(), zip);
            zip.closeArchiveEntry();
        }
    }

    private boolean isBundled(final File f) {
        final String name = f.getName().toLowerCase(ROOT);
        return name.endsWith(".adf") || name.endsWith(".png") || name.endsWith(".jpg") || name.endsWith(".jpeg")
                || name.endsWith(".gif") || name.endsWith(".svg");
    }

    private void attach(final String ext, final File output) {
        if (attach) {
            getLog().info("Attaching adf files as a " + ext);
            if (classifier != null) {
                projectHelper.attachArtifact(project, ext, classifier, output);
            } else {
                projectHelper.attachArtifact(project, ext, output);
            }
        }
    }
}
