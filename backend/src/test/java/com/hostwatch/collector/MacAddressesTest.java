package com.hostwatch.collector;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class MacAddressesTest {

    @Test
    void format_writesLowerCaseBigEndianOctets() {
        assertThat(MacAddresses.format(0x0242AC110002L)).isEqualTo("02:42:ac:11:00:02");
        assertThat(MacAddresses.format(0L)).isEqualTo("00:00:00:00:00:00");
    }

    @Test
    void format_ignoresBitsAboveFortyEight() {
        assertThat(MacAddresses.format(0xFFFF_0000_0000_0001L)).isEqualTo("00:00:00:00:00:01");
    }

    @Test
    void parse_acceptsColonAndDashSeparators() {
        assertThat(MacAddresses.parse("AA:BB:CC:DD:EE:FF")).isEqualTo(0xAABBCCDDEEFFL);
        assertThat(MacAddresses.parse("aa-bb-cc-dd-ee-ff")).isEqualTo(0xAABBCCDDEEFFL);
    }

    @Test
    void parse_malformed_returnsZero() {
        assertThat(MacAddresses.parse(null)).isZero();
        assertThat(MacAddresses.parse("")).isZero();
        assertThat(MacAddresses.parse("aa:bb:cc")).isZero();
        assertThat(MacAddresses.parse("zz:bb:cc:dd:ee:ff")).isZero();
        assertThat(MacAddresses.parse("aaa:bb:cc:dd:ee:ff")).isZero();
    }
}
