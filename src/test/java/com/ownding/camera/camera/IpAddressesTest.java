package com.ownding.camera.camera;

import org.junit.jupiter.api.Test;

import java.net.Inet6Address;
import java.net.InetAddress;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IpAddressesTest {

    @Test
    void parsesIpv4Literal() {
        InetAddress address = IpAddresses.parse("192.168.1.20").orElseThrow();
        assertEquals("192.168.1.20", IpAddresses.canonical(address));
    }

    @Test
    void parsesIpv6LiteralIntoCanonicalForm() {
        InetAddress compressed = IpAddresses.parse("2001:db8::1").orElseThrow();
        InetAddress expanded = IpAddresses.parse("2001:0db8:0:0:0:0:0:1").orElseThrow();
        assertEquals(IpAddresses.canonical(compressed), IpAddresses.canonical(expanded));
    }

    @Test
    void rejectsMalformedLiterals() {
        assertTrue(IpAddresses.parse("not-an-ip").isEmpty());
        assertTrue(IpAddresses.parse("256.0.0.1").isEmpty());
        assertTrue(IpAddresses.parse("10.0.0").isEmpty());
        assertTrue(IpAddresses.parse("010.0.0.1").isEmpty());
        assertTrue(IpAddresses.parse("localhost").isEmpty());
        assertTrue(IpAddresses.parse("").isEmpty());
        assertTrue(IpAddresses.parse(null).isEmpty());
        assertTrue(IpAddresses.parse("2001:db8::zz").isEmpty());
    }

    @Test
    void ipv4MappedLiteralStaysIpv6() {
        InetAddress mapped = IpAddresses.parse("::ffff:10.0.0.1").orElseThrow();
        InetAddress plain = IpAddresses.parse("10.0.0.1").orElseThrow();

        assertTrue(mapped instanceof Inet6Address);
        assertNotEquals(IpAddresses.canonical(plain), IpAddresses.canonical(mapped));
        assertFalse(IpAddresses.sameFamily(mapped, plain));
        assertEquals(mapped, IpAddresses.parse(IpAddresses.canonical(mapped)).orElseThrow());
    }

    @Test
    void rejectsSurroundingWhitespace() {
        assertTrue(IpAddresses.parse(" 10.0.0.1 ").isEmpty());
        assertTrue(IpAddresses.parse("10.0.0.1\n").isEmpty());
        assertTrue(IpAddresses.parse(" ::1").isEmpty());
    }

    @Test
    void comparesNumericallyNotLexically() {
        InetAddress nine = IpAddresses.parse("10.0.0.9").orElseThrow();
        InetAddress hundred = IpAddresses.parse("10.0.0.100").orElseThrow();
        InetAddress high = IpAddresses.parse("200.0.0.1").orElseThrow();

        assertTrue(IpAddresses.compare(nine, hundred) < 0);
        assertTrue(IpAddresses.compare(high, hundred) > 0);
        assertEquals(0, IpAddresses.compare(nine, IpAddresses.parse("10.0.0.9").orElseThrow()));
    }

    @Test
    void rangeBoundsAreInclusiveAndOptional() {
        InetAddress from = IpAddresses.parse("10.0.0.5").orElseThrow();
        InetAddress to = IpAddresses.parse("10.0.0.10").orElseThrow();

        assertTrue(IpAddresses.inRange(from, from, to));
        assertTrue(IpAddresses.inRange(to, from, to));
        assertFalse(IpAddresses.inRange(IpAddresses.parse("10.0.0.11").orElseThrow(), from, to));
        assertTrue(IpAddresses.inRange(IpAddresses.parse("10.0.0.11").orElseThrow(), from, null));
        assertTrue(IpAddresses.inRange(IpAddresses.parse("1.1.1.1").orElseThrow(), null, to));
    }

    @Test
    void otherFamilyIsOutsideRange() {
        InetAddress v6 = IpAddresses.parse("::2").orElseThrow();
        InetAddress from = IpAddresses.parse("0.0.0.0").orElseThrow();

        assertFalse(IpAddresses.inRange(v6, from, null));
        assertThrows(IllegalArgumentException.class, () -> IpAddresses.compare(v6, from));
    }
}
