package com.example.backup.infrastructure.transport;

import com.example.backup.domain.exception.TransientIoException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 로컬/마운트된 파일시스템 아카이브
 * 임시 파일에 쓴 뒤 원자적으로 이동하여 부분 객체가 보이지 않도록 한다.
 */
@Slf4j
public class FileSystemArchiveTransport implements ArchiveTransport {

    private final Path root;

    public FileSystemArchiveTransport(Path root) {
        this.root = root.toAbsolutePath().normalize();
        try {
            Files.createDirectories(this.root);
        } catch (IOException e) {
            throw new TransientIoException("Cannot create archive root " + this.root, e);
        }
    }

    @Override
    public void put(String location, byte[] content) {
        Path target = resolve(location);
        try {
            Files.createDirectories(target.getParent());
            Path temp = Files.createTempFile(target.getParent(), ".upload-", ".tmp");
            try {
                Files.write(temp, content);
                try {
                    Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
                } catch (AtomicMoveNotSupportedException e) {
                    Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
                }
            } finally {
                Files.deleteIfExists(temp);
            }
            log.debug("Archived object: location={}, bytes={}", location, content.length);
        } catch (IOException e) {
            throw new TransientIoException("Failed to write archive object " + location,
                    Map.of("location", location), e);
        }
    }

    @Override
    public byte[] get(String location) {
        try {
            return Files.readAllBytes(resolve(location));
        } catch (NoSuchFileException e) {
            throw new ArchiveObjectNotFoundException(location);
        } catch (IOException e) {
            throw new TransientIoException("Failed to read archive object " + location,
                    Map.of("location", location), e);
        }
    }

    @Override
    public Optional<ArchiveObject> stat(String location) {
        Path path = resolve(location);
        try {
            BasicFileAttributes attributes = Files.readAttributes(path, BasicFileAttributes.class);
            return Optional.of(new ArchiveObject(location, attributes.size(), attributes.lastModifiedTime().toInstant()));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new TransientIoException("Failed to stat archive object " + location,
                    Map.of("location", location), e);
        }
    }

    @Override
    public void delete(String location) {
        try {
            Files.deleteIfExists(resolve(location));
        } catch (IOException e) {
            throw new TransientIoException("Failed to delete archive object " + location,
                    Map.of("location", location), e);
        }
    }

    @Override
    public List<String> list(String prefix) {
        if (!Files.isDirectory(root)) {
            return List.of();
        }
        try (Stream<Path> files = Files.walk(root)) {
            return files.filter(Files::isRegularFile)
                    .map(this::toLocation)
                    .filter(location -> location.startsWith(prefix))
                    .filter(location -> !location.endsWith(".tmp"))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new TransientIoException("Failed to list archive prefix " + prefix,
                    Map.of("prefix", prefix), e);
        }
    }

    @Override
    public StorageUsage usage() {
        try (Stream<Path> files = Files.walk(root)) {
            long[] totals = new long[2];
            files.filter(Files::isRegularFile).forEach(path -> {
                totals[0] += path.toFile().length();
                totals[1]++;
            });
            long available = Files.getFileStore(root).getUsableSpace();
            return new StorageUsage(totals[0], available, totals[1]);
        } catch (IOException e) {
            throw new TransientIoException("Failed to compute archive usage", e);
        }
    }

    @Override
    public String describe() {
        return "filesystem:" + root;
    }

    private Path resolve(String location) {
        Path path = root.resolve(location).normalize();
        if (!path.startsWith(root)) {
            throw new IllegalArgumentException("Location escapes archive root: " + location);
        }
        return path;
    }

    private String toLocation(Path path) {
        return root.relativize(path).toString().replace('\\', '/');
    }
}
