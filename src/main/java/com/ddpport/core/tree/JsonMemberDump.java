package com.ddpport.core.tree;

import com.ddpport.core.fs.ArchiveReader;
import com.ddpport.core.json.OrderedJsonReader;
import com.ddpport.core.table.RowSet;
import com.ddpport.logging.AppLogger;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Lists every flattened key of every JSON member of an archive. Used to inspect exports with an unknown layout.
 */
public final class JsonMemberDump {
    private static final Logger LOGGER = AppLogger.get();

    public static final List<String> COLUMNS = List.of("File name", "Key", "Value");

    private JsonMemberDump() {
    }

    public static RowSet dumpJsonMembers(Path archive) {
        try {
            List<List<Object>> rows = new ArrayList<>();
            for (ArchiveReader.Member member : ArchiveReader.readMembersWithSuffix(archive, ".json")) {
                Map<String, Object> flat = TreeFlattener.flatten(OrderedJsonReader.read(member.content()));
                for (Map.Entry<String, Object> entry : flat.entrySet()) {
                    rows.add(Arrays.asList(member.name(), entry.getKey(), entry.getValue()));
                }
            }
            return new RowSet(COLUMNS, rows);
        } catch (IOException | RuntimeException ex) {
            LOGGER.log(Level.SEVERE, "Could not dump JSON members of " + archive + ": " + ex.getMessage(), ex);
            return RowSet.empty();
        }
    }
}
