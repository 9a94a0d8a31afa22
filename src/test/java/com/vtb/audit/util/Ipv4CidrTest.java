package com.vtb.audit.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class Ipv4CidrTest {

    @Test
    void testContainsAddressInsideRange() {
        Ipv4Cidr cidr = Ipv4Cidr.parse("10.0.0.0/24");

        assertTrue(cidr.contains("10.0.0.5"));
        assertTrue(cidr.contains("10.0.0.255"));
        assertFalse(cidr.contains("10.0.1.0"));
    }

    @Test
    void testHostBitsAreMasked() {
        Ipv4Cidr cidr = Ipv4Cidr.parse("192.168.1.77/16");

        assertEquals("192.168.0.0/16", cidr.toString());
        assertTrue(cidr.contains("192.168.200.1"));
    }

    @Test
    void testZeroPrefixContainsEverything() {
        Ipv4Cidr cidr = Ipv4Cidr.parse("0.0.0.0/0");

        assertTrue(cidr.contains("8.8.8.8"));
        assertTrue(cidr.contains("255.255.255.255"));
    }

    @Test
    void testSingleHostPrefix() {
        Ipv4Cidr cidr = Ipv4Cidr.parse("10.1.1.1/32");

        assertTrue(cidr.contains("10.1.1.1"));
        assertFalse(cidr.contains("10.1.1.2"));
    }

    @Test
    void testInvalidAddressNeverMatches() {
        Ipv4Cidr cidr = Ipv4Cidr.parse("10.0.0.0/8");

        assertFalse(cidr.contains(null));
        assertFalse(cidr.contains(""));
        assertFalse(cidr.contains("10.0.0"));
        assertFalse(cidr.contains("10.0.0.300"));
        assertFalse(cidr.contains("fe80::1"));
    }

    @Test
    void testRejectsMalformedCidr() {
        assertThrows(IllegalArgumentException.class, () -> Ipv4Cidr.parse("10.0.0.0"));
        assertThrows(IllegalArgumentException.class, () -> Ipv4Cidr.parse("10.0.0.0/"));
        assertThrows(IllegalArgumentException.class, () -> Ipv4Cidr.parse("10.0.0.0/33"));
        assertThrows(IllegalArgumentException.class, () -> Ipv4Cidr.parse("10.0.0/24"));
        assertThrows(IllegalArgumentException.class, () -> Ipv4Cidr.parse("abc/24"));
        assertThrows(IllegalArgumentException.class, () -> Ipv4Cidr.parse(null));
    }
}
