package com.webcrawler.core.model;

import org.junit.jupiter.api.Test;

import java.net.URI;

import static org.junit.jupiter.api.Assertions.*;

class WorkItemTest {

    @Test
    void child_is_one_deeper() {
        WorkItem seed = WorkItem.seed(URI.create("http://ex.test/"));
        WorkItem child = seed.child(URI.create("http://ex.test/a"));
        assertEquals(0, seed.depth());
        assertEquals(1, child.depth());
        assertEquals(2, child.child(URI.create("http://ex.test/b")).depth());
    }

    @Test
    void invalid_items_rejected() {
        assertThrows(NullPointerException.class, () -> new WorkItem(null, 0));
        assertThrows(IllegalArgumentException.class, () -> new WorkItem(URI.create("http://ex.test/"), -1));
    }
}
