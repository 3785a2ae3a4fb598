package com.ddpport.core.fs;

import com.ddpport.testing.ZipFixtures;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ArchiveReaderTest {

    @TempDir
    Path tempDir;

    @Test
    void listsBaseNamesAndIgnoresDirectoriesAndResourceForks() throws IOException {
        Path archive = ZipFixtures.zip(tempDir.resolve("takeout.zip"),
                "Takeout/", "",
                "Takeout/YouTube/history/watch-history.html", "<html></html>",
                "__MACOSX/Takeout/._watch-history.html", "fork",
                "Takeout/YouTube/._subscriptions.csv", "fork",
                "Takeout/YouTube/subscriptions/subscriptions.csv", "Channel Id\n");

        assertEquals(List.of("watch-history.html", "subscriptions.csv"), ArchiveReader.listMemberNames(archive));
    }

    @Test
    void readsFirstMemberWithMatchingBaseName() throws IOException {
        Path archive = ZipFixtures.zip(tempDir.resolve("data.zip"),
                "a/user_data.json", "{\"first\": true}",
                "b/user_data.json", "{\"second\": true}");

        Optional<byte[]> content = ArchiveReader.readMember(archive, "user_data.json");

        assertTrue(content.isPresent());
        assertEquals("{\"first\": true}", new String(content.get(), StandardCharsets.UTF_8));
        assertTrue(ArchiveReader.readMember(archive, "missing.json").isEmpty());
    }

    @Test
    void readsMembersBySuffix() throws IOException {
        Path archive = ZipFixtures.zip(tempDir.resolve("mixed.zip"),
                "one.json", "1",
                "notes.txt", "n",
                "nested/two.json", "2");

        List<ArchiveReader.Member> members = ArchiveReader.readMembersWithSuffix(archive, ".json");

        assertEquals(2, members.size());
        assertEquals("one.json", members.get(0).name());
        assertEquals("two.json", members.get(1).name());
        assertEquals("2", new String(members.get(1).content(), StandardCharsets.UTF_8));
    }

    @Test
    void failsOnFilesThatAreNotArchives() throws IOException {
        Path notAZip = Files.writeString(tempDir.resolve("plain.zip"), "definitely not a zip file");

        assertThrows(IOException.class, () -> ArchiveReader.listMemberNames(notAZip));
        assertThrows(IOException.class, () -> ArchiveReader.readMember(notAZip, "x.json"));
    }

    @Test
    void baseNameStripsDirectories() {
        assertEquals("file.csv", ArchiveReader.baseName("a/b/file.csv"));
        assertEquals("file.csv", ArchiveReader.baseName("file.csv"));
    }
}
