package com.axlabs.neo.yieldshares;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class ConfigTest {

    @AfterEach
    public void tearDown() {
        Config.setProfile(null);
    }

    @Test
    public void read_default_properties() {
        Config.setProfile(null);
        assertThat(Config.getLongProperty("voting_delay"), is(86_400L));
        assertThat(Config.getIntProperty("quorum_bp"), is(1_000));
        assertThat(Config.getProperty("ledger_mode"), is("SINGLE"));
        assertThat(Config.getBooleanProperty("voting_power_snapshots"), is(false));
        assertThat(Config.getProperty("unknown"), is(nullValue()));
    }

    @Test
    public void override_defaults_with_profile() {
        Config.setProfile("shared");
        assertThat(Config.getProperty("ledger_mode"), is("SHARED"));
        assertThat(Config.getIntProperty("max_shareholders"), is(1_000));

        Config.setProfile("snapshot");
        assertThat(Config.getBooleanProperty("voting_power_snapshots"), is(true));
        assertThat(Config.getProperty("ledger_mode"), is("SINGLE"));
    }

    @Test
    public void fail_reading_missing_property_or_profile() {
        assertThrows(IllegalStateException.class, () -> Config.getIntProperty("unknown"));

        Config.setProfile("missing");
        assertThrows(IllegalStateException.class, () -> Config.getProperty("voting_delay"));
    }
}
