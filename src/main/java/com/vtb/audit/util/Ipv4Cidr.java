package com.vtb.audit.util;

/**
 * Диапазон IPv4 адресов в нотации CIDR.
 *
 * Базовый адрес маскируется по длине префикса, т.е. 10.0.0.5/24 даёт 10.0.0.0/24.
 */
public final class Ipv4Cidr {

    private final int network;
    private final int mask;
    private final int prefixLength;

    private Ipv4Cidr(int network, int mask, int prefixLength) {
        this.network = network;
        this.mask = mask;
        this.prefixLength = prefixLength;
    }

    /**
     * Разобрать строку вида a.b.c.d/n
     *
     * @throws IllegalArgumentException если адрес или префикс некорректны
     */
    public static Ipv4Cidr parse(String cidr) {
        if (cidr == null || cidr.isBlank()) {
            throw new IllegalArgumentException("CIDR не может быть пустым");
        }
        int slash = cidr.indexOf('/');
        if (slash < 0) {
            throw new IllegalArgumentException("CIDR должен содержать '/': " + cidr);
        }
        Integer address = parseAddress(cidr.substring(0, slash));
        if (address == null) {
            throw new IllegalArgumentException("Некорректный IPv4 адрес в CIDR: " + cidr);
        }
        String prefixText = cidr.substring(slash + 1);
        if (prefixText.isEmpty() || prefixText.length() > 2 || !prefixText.chars().allMatch(Character::isDigit)) {
            throw new IllegalArgumentException("Некорректная длина префикса в CIDR: " + cidr);
        }
        int prefix = Integer.parseInt(prefixText);
        if (prefix > 32) {
            throw new IllegalArgumentException("Длина префикса больше 32: " + cidr);
        }
        int mask = prefix == 0 ? 0 : -1 << (32 - prefix);
        return new Ipv4Cidr(address & mask, mask, prefix);
    }

    /**
     * Разобрать IPv4 адрес в точечной нотации
     *
     * @return адрес как int или null, если строка не является IPv4 адресом
     */
    public static Integer parseAddress(String text) {
        if (text == null) {
            return null;
        }
        String[] octets = text.trim().split("\\.", -1);
        if (octets.length != 4) {
            return null;
        }
        int result = 0;
        for (String octet : octets) {
            if (octet.isEmpty() || octet.length() > 3 || !octet.chars().allMatch(Character::isDigit)) {
                return null;
            }
            int value = Integer.parseInt(octet);
            if (value > 255) {
                return null;
            }
            result = (result << 8) | value;
        }
        return result;
    }

    /**
     * Входит ли адрес в диапазон. Строка, не являющаяся IPv4 адресом, не входит никогда.
     */
    public boolean contains(String address) {
        Integer parsed = parseAddress(address);
        return parsed != null && (parsed & mask) == network;
    }

    @Override
    public String toString() {
        return ((network >>> 24) & 0xFF) + "." + ((network >>> 16) & 0xFF) + "."
            + ((network >>> 8) & 0xFF) + "." + (network & 0xFF) + "/" + prefixLength;
    }
}
