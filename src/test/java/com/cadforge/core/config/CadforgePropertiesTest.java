package com.cadforge.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CadforgePropertiesTest {

    @Test
    @DisplayName("solver tolerances default to 0.01")
    void solverDefaults() {
        var props = new CadforgeProperties();
        assertEquals(0.01, props.getSolver().getDefaultTolerance());
        assertEquals(0.01, props.getSolver().getAngularTolerance());
    }

    @Test
    @DisplayName("root workspace defaults to main")
    void rootDefaults() {
        var props = new CadforgeProperties();
        assertEquals("main", props.getWorkspace().getRootId());
        assertEquals(60, props.getWorkspace().getMergeLockTtlSeconds());
    }

    @Test
    @DisplayName("lease defaults are 300s with a 3600s ceiling on an auto-selected store")
    void lockDefaults() {
        var props = new CadforgeProperties();
        assertEquals("auto", props.getLocks().getStore());
        assertEquals(300, props.getLocks().getDefaultTtlSeconds());
        assertEquals(3600, props.getLocks().getMaxTtlSeconds());
    }

    @Test
    @DisplayName("all properties are configurable via setters")
    void setters() {
        var props = new CadforgeProperties();
        props.getSolver().setDefaultTolerance(0.001);
        props.getWorkspace().setRootId("trunk");
        props.getLocks().setStore("jdbc");
        props.getLocks().setMaxTtlSeconds(60);

        assertEquals(0.001, props.getSolver().getDefaultTolerance());
        assertEquals("trunk", props.getWorkspace().getRootId());
        assertEquals("jdbc", props.getLocks().getStore());
        assertEquals(60, props.getLocks().getMaxTtlSeconds());
    }
}
