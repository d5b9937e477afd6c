package com.ownding.camera.camera;

import java.net.Inet4Address;
import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.NetworkInterface;
import java.net.UnknownHostException;
import java.util.Arrays;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsing and ordering of IP address literals. Host names are never resolved, surrounding whitespace is
 * rejected, and an IPv4-mapped IPv6 literal stays an IPv6 address.
 */
public final class IpAddresses {

    private static final Pattern IPV4 = Pattern.compile("^(\\d{1,3})\\.(\\d{1,3})\\.(\\d{1,3})\\.(\\d{1,3})$");
    private static final Pattern IPV6 = Pattern.compile("^[0-9A-Fa-f:.]+$");

    private IpAddresses() {
    }

    public static Optional<InetAddress> parse(String literal) {
        if (literal == null) {
            return Optional.empty();
        }
        Matcher matcher = IPV4.matcher(literal);
        if (matcher.matches()) {
            byte[] octets = new byte[4];
            for (int i = 0; i < 4; i++) {
                String group = matcher.group(i + 1);
                if (group.length() > 1 && group.charAt(0) == '0') {
                    return Optional.empty();
                }
                int octet = Integer.parseInt(group);
                if (octet > 255) {
                    return Optional.empty();
                }
                octets[i] = (byte) octet;
            }
            return fromBytes(octets);
        }
        // a colon guarantees InetAddress treats the value as an IPv6 literal and never does a lookup
        if (literal.indexOf(':') >= 0 && IPV6.matcher(literal).matches()) {
            try {
                byte[] bytes = InetAddress.getByName(literal).getAddress();
                if (bytes.length == 4) {
                    // InetAddress unwraps ::ffff:a.b.c.d to IPv4; keep it an IPv6 address
                    bytes = ipv4Mapped(bytes);
                }
                return Optional.of(Inet6Address.getByAddress(null, bytes, (NetworkInterface) null));
            } catch (UnknownHostException ex) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    public static String canonical(InetAddress address) {
        return address.getHostAddress();
    }

    public static boolean sameFamily(InetAddress left, InetAddress right) {
        return (left instanceof Inet4Address) == (right instanceof Inet4Address);
    }

    /**
     * Numeric ordering of two addresses of the same family.
     *
     * @throws IllegalArgumentException if the families differ
     */
    public static int compare(InetAddress left, InetAddress right) {
        if (!sameFamily(left, right)) {
            throw new IllegalArgumentException("cannot order IPv4 against IPv6: " + left + " / " + right);
        }
        return Arrays.compareUnsigned(left.getAddress(), right.getAddress());
    }

    /**
     * Inclusive range test; a {@code null} bound is open. A bound of the other family excludes the address.
     */
    public static boolean inRange(InetAddress address, InetAddress from, InetAddress to) {
        if (from != null && (!sameFamily(address, from) || compare(address, from) < 0)) {
            return false;
        }
        return to == null || (sameFamily(address, to) && compare(address, to) <= 0);
    }

    private static byte[] ipv4Mapped(byte[] octets) {
        byte[] bytes = new byte[16];
        bytes[10] = (byte) 0xff;
        bytes[11] = (byte) 0xff;
        System.arraycopy(octets, 0, bytes, 12, 4);
        return bytes;
    }

    private static Optional<InetAddress> fromBytes(byte[] octets) {
        try {
            return Optional.of(InetAddress.getByAddress(octets));
        } catch (UnknownHostException ex) {
            throw new IllegalStateException("four octets are always a valid address", ex);
        }
    }
}
