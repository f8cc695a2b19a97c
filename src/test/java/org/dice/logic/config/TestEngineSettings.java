package org.dice.logic.config;

import org.junit.After;
import org.junit.Test;

import java.util.Properties;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class TestEngineSettings {

    @After
    public void clearOverrides() {
        System.clearProperty(EngineSettings.MAX_VARIABLES);
        System.clearProperty(EngineSettings.PARALLEL);
    }

    @Test
    public void loadsBundledResource() {
        EngineSettings settings = EngineSettings.load();
        assertEquals(EngineSettings.DEFAULT_MAX_VARIABLES, settings.getMaxVariables());
        assertFalse(settings.isParallel());
    }

    @Test
    public void systemPropertiesOverrideResource() {
        System.setProperty(EngineSettings.MAX_VARIABLES, "6");
        System.setProperty(EngineSettings.PARALLEL, "TRUE");
        EngineSettings settings = EngineSettings.load();
        assertEquals(6, settings.getMaxVariables());
        assertTrue(settings.isParallel());
    }

    @Test
    public void invalidValuesFallBackToDefaults() {
        Properties props = new Properties();
        props.setProperty(EngineSettings.MAX_VARIABLES, "lots");
        props.setProperty(EngineSettings.PARALLEL, "sometimes");
        EngineSettings settings = EngineSettings.fromProperties(props);
        assertEquals(EngineSettings.DEFAULT_MAX_VARIABLES, settings.getMaxVariables());
        assertEquals(EngineSettings.DEFAULT_PARALLEL, settings.isParallel());

        props.setProperty(EngineSettings.MAX_VARIABLES, "25");
        assertEquals(EngineSettings.DEFAULT_MAX_VARIABLES, EngineSettings.fromProperties(props).getMaxVariables());
        props.setProperty(EngineSettings.MAX_VARIABLES, "-1");
        assertEquals(EngineSettings.DEFAULT_MAX_VARIABLES, EngineSettings.fromProperties(props).getMaxVariables());
    }

    @Test
    public void missingValuesUseDefaults() {
        EngineSettings settings = EngineSettings.fromProperties(new Properties());
        assertEquals(EngineSettings.DEFAULT_MAX_VARIABLES, settings.getMaxVariables());
        assertFalse(settings.isParallel());
    }

    @Test
    public void acceptsTheLimit() {
        Properties props = new Properties();
        props.setProperty(EngineSettings.MAX_VARIABLES, " 24 ");
        assertEquals(24, EngineSettings.fromProperties(props).getMaxVariables());
    }

    @Test(expected = IllegalArgumentException.class)
    public void constructorRejectsValuesAboveTheLimit() {
        new EngineSettings(EngineSettings.MAX_VARIABLES_LIMIT + 1, false);
    }
}
