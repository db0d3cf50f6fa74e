package com.scholarly.citegraph.repository;

import com.scholarly.citegraph.exception.GraphNotFoundException;
import com.scholarly.citegraph.exception.GraphStorageException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.file.*;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Stores serialized graphs as {@code <name>.json} files in the storage directory.
 */
@Repository
@Slf4j
public class GraphFileRepository {

    public static final String FILE_PREFIX = "citation_graph_";
    private static final String EXTENSION = ".json";

    private final Path directory;

    public GraphFileRepository(@Value("${citegraph.storage.directory:./graphs}") String directory) {
        this.directory = Path.of(directory);
    }

    /**
     * Default graph name for a root identifier, e.g. {@code citation_graph_10.1021_acsnano.1c00001}.
     */
    public static String nameFor(String root) {
        return FILE_PREFIX + sanitize(root);
    }

    public static String sanitize(String value) {
        return value.replaceAll("[^A-Za-z0-9._-]", "_");
    }

    public Path write(String name, byte[] bytes) {
        Path target = resolve(name);
        try {
            Files.createDirectories(directory);
            Path temp = Files.createTempFile(directory, name, ".tmp");
            Files.write(temp, bytes);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.info("Saved graph {} ({} bytes)", target.getFileName(), bytes.length);
            return target;
        } catch (IOException e) {
            throw new GraphStorageException("Failed to write graph " + name, e);
        }
    }

    public byte[] read(String name) {
        Path path = resolve(name);
        if (!Files.isRegularFile(path)) {
            throw new GraphNotFoundException("Graph not found: " + name);
        }
        try {
            return Files.readAllBytes(path);
        } catch (IOException e) {
            throw new GraphStorageException("Failed to read graph " + name, e);
        }
    }

    public boolean exists(String name) {
        return Files.isRegularFile(resolve(name));
    }

    public void delete(String name) {
        Path path = resolve(name);
        try {
            if (!Files.deleteIfExists(path)) {
                throw new GraphNotFoundException("Graph not found: " + name);
            }
            log.info("Deleted graph {}", path.getFileName());
        } catch (IOException e) {
            throw new GraphStorageException("Failed to delete graph " + name, e);
        }
    }

    /**
     * Stored graphs, newest first.
     */
    public List<StoredGraphFile> list() {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        List<StoredGraphFile> graphs = new ArrayList<>();
        try (Stream<Path> files = Files.list(directory)) {
            for (Path path : (Iterable<Path>) files::iterator) {
                String fileName = path.getFileName().toString();
                if (!Files.isRegularFile(path) || !fileName.endsWith(EXTENSION)) {
                    continue;
                }
                FileTime modified = Files.getLastModifiedTime(path);
                graphs.add(new StoredGraphFile(
                        fileName.substring(0, fileName.length() - EXTENSION.length()),
                        Files.size(path),
                        modified.toInstant()));
            }
        } catch (IOException e) {
            throw new GraphStorageException("Failed to list graphs in " + directory, e);
        }
        graphs.sort(Comparator.comparing(StoredGraphFile::getModifiedAt).reversed()
                .thenComparing(StoredGraphFile::getName));
        return graphs;
    }

    private Path resolve(String name) {
        if (name == null || name.isBlank() || !name.equals(sanitize(name)) || name.startsWith(".")) {
            throw new GraphNotFoundException("Graph not found: " + name);
        }
        return directory.resolve(name + EXTENSION);
    }
}
