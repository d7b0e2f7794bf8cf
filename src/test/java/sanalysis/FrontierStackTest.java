package sanalysis;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class FrontierStackTest {

    @Test
    void testStartsWithOneEmptyFrontier() {
        FrontierStack frontiers = new FrontierStack();
        assertEquals(1, frontiers.depth());
        assertTrue(frontiers.peek().isEmpty());
    }

    @Test
    void testDuplicateCopiesTheTop() {
        FrontierStack frontiers = new FrontierStack();
        frontiers.push(Set.of(3));
        frontiers.duplicate();
        frontiers.add(4);

        assertEquals(Set.of(3, 4), frontiers.pop());
        assertEquals(Set.of(3), frontiers.pop(), "The copied frontier leaves the one below it untouched");
    }

    @Test
    void testPopKeepsInsertionOrder() {
        FrontierStack frontiers = new FrontierStack();
        frontiers.pushEmpty();
        frontiers.add(7);
        frontiers.add(2);
        frontiers.add(5);

        assertEquals(List.of(7, 2, 5), List.copyOf(frontiers.pop()));
    }

    @Test
    void testPopOnEmptyStackFails() {
        FrontierStack frontiers = new FrontierStack();
        frontiers.pop();
        assertThrows(IllegalStateException.class, frontiers::pop);
    }
}
