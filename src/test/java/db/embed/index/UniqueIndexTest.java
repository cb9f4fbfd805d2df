package db.embed.index;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

import db.embed.storage.Value;

public class UniqueIndexTest {

    @Test
    void membershipIsKindAware() {
        UniqueIndex idx = new UniqueIndex("id", 0);
        assertTrue(idx.add(Value.of(1)));
        assertFalse(idx.add(Value.of(1)));
        assertTrue(idx.contains(Value.of(1)));
        assertFalse(idx.contains(Value.of("1")));
        idx.remove(Value.of(1));
        assertEquals(0, idx.size());
    }

    @Test
    void valuesViewIsReadOnly() {
        UniqueIndex idx = new UniqueIndex("name", 1);
        idx.add(Value.of("a"));
        assertThrows(UnsupportedOperationException.class, () -> idx.values().add(Value.of("b")));
        idx.clear();
        assertTrue(idx.values().isEmpty());
    }
}
