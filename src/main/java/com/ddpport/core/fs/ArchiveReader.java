package com.ddpport.core.fs;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.List;
import java.util.Optional;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

/**
 * Read-only access to the members of a zip archive. The archive is opened and closed within every call,
 * so no handle outlives a single operation.
 */
public final class ArchiveReader {
    private ArchiveReader() {
    }

    /**
     * Lists the base names (text after the last {@code /}) of all file members, in archive order.
     *
     * @throws IOException if the file is not a readable zip archive
     */
    public static List<String> listMemberNames(Path archive) throws IOException {
        List<String> names = new ArrayList<>();
        try (ZipFile zf = new ZipFile(archive.toFile())) {
            Enumeration<? extends ZipEntry> entries = zf.entries();
            while (entries.hasMoreElements()) {
                ZipEntry entry = entries.nextElement();
                if (entry.isDirectory() || isResourceFork(entry.getName())) {
                    continue;
                }
                names.add(baseName(entry.getName()));
            }
        }
        return names;
    }

    /**
     * Reads the first member whose base name equals {@code fileName}.
     *
     * @throws IOException if the archive cannot be read
     */
    public static Optional<byte[]> readMember(Path archive, String fileName) throws IOException {
        try (ZipFile zf = new ZipFile(archive.toFile())) {
            Enumeration<? extends ZipEntry> entries = zf.entries();
            while (entries.hasMoreElements()) {
                ZipEntry entry = entries.nextElement();
                if (entry.isDirectory() || isResourceFork(entry.getName())) {
                    continue;
                }
                if (baseName(entry.getName()).equals(fileName)) {
                    try (InputStream is = zf.getInputStream(entry)) {
                        return Optional.of(is.readAllBytes());
                    }
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Reads every member whose name ends with {@code suffix}, keyed by base name.
     */
    public static List<Member> readMembersWithSuffix(Path archive, String suffix) throws IOException {
        List<Member> members = new ArrayList<>();
        try (ZipFile zf = new ZipFile(archive.toFile())) {
            Enumeration<? extends ZipEntry> entries = zf.entries();
            while (entries.hasMoreElements()) {
                ZipEntry entry = entries.nextElement();
                if (entry.isDirectory() || isResourceFork(entry.getName()) || !entry.getName().endsWith(suffix)) {
                    continue;
                }
                try (InputStream is = zf.getInputStream(entry)) {
                    members.add(new Member(baseName(entry.getName()), is.readAllBytes()));
                }
            }
        }
        return members;
    }

    static String baseName(String entryName) {
        int slash = entryName.lastIndexOf('/');
        return slash < 0 ? entryName : entryName.substring(slash + 1);
    }

    private static boolean isResourceFork(String entryName) {
        return entryName.startsWith("__MACOSX/") || entryName.contains("/._");
    }

    public record Member(String name, byte[] content) {
    }
}
