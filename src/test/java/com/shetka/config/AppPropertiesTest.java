package com.shetka.config;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AppPropertiesTest {

    @Test
    void corsOrigins_unsetMeansAllowAll() {
        AppProperties.Cors cors = new AppProperties.Cors();

        assertThat(cors.originList()).isEmpty();

        cors.setOrigins("   ");
        assertThat(cors.originList()).isEmpty();
    }

    @Test
    void corsOrigins_splitsAndTrimsCommaList() {
        AppProperties.Cors cors = new AppProperties.Cors();
        cors.setOrigins(" https://shetka.app, ,https://t.me ,");

        assertThat(cors.originList()).containsExactly("https://shetka.app", "https://t.me");
    }

    @Test
    void defaults_matchSmallFixedPool() {
        AppProperties properties = new AppProperties();

        assertThat(properties.getDb().getPool().getMaxSize()).isEqualTo(5);
        assertThat(properties.getDb().getPool().getMinIdle()).isEqualTo(1);
        assertThat(properties.getDb().getDialect()).isEqualTo("postgresql");
        assertThat(properties.getTelegram().getInitDataMaxAge()).isZero();
    }
}
