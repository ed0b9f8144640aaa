package org.muma.redis.cli.command;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CommandHistoryTest {

    @Test
    void testIgnoresBlankAndConsecutiveDuplicates() {
        CommandHistory history = new CommandHistory();
        history.add("get a");
        history.add("  get a ");
        history.add("");
        history.add(null);
        history.add("get b");
        history.add("get a");

        assertEquals(List.of("get a", "get b", "get a"), history.getAll());
    }

    @Test
    void testEvictsOldestWhenFull() {
        CommandHistory history = new CommandHistory(2);
        history.add("one");
        history.add("two");
        history.add("three");

        assertEquals(List.of("two", "three"), history.getAll());
    }

    @Test
    void testRender() {
        CommandHistory history = new CommandHistory();
        assertEquals("No command history.", history.render());

        history.add("ping");
        String rendered = history.render();
        assertTrue(rendered.contains("   1: ping"));
        assertTrue(rendered.endsWith("Total: 1 commands"));
    }

    @Test
    void testHistoryCommandDetection() {
        assertTrue(CommandHistory.isHistoryCommand(" _HISTORY "));
        assertFalse(CommandHistory.isHistoryCommand("history"));
    }
}
