package org.argus.address;

import java.util.List;

/** Special-purpose IPv4 blocks that are not globally routable. */
final class Ipv4Ranges {
    private static final List<Block> NON_GLOBAL = List.of(
            block(0x00000000, 8),   // this network
            block(0x0A000000, 8),   // private
            block(0x64400000, 10),  // shared address space
            block(0x7F000000, 8),   // loopback
            block(0xA9FE0000, 16),  // link-local
            block(0xAC100000, 12),  // private
            block(0xC0000000, 24),  // IETF protocol assignments
            block(0xC0000200, 24),  // TEST-NET-1
            block(0xC0586300, 24),  // 6to4 relay anycast
            block(0xC0A80000, 16),  // private
            block(0xC6120000, 15),  // benchmarking
            block(0xC6336400, 24),  // TEST-NET-2
            block(0xCB007100, 24),  // TEST-NET-3
            block(0xE0000000, 4),   // multicast
            block(0xF0000000, 4)    // reserved, includes limited broadcast
    );

    private Ipv4Ranges() {
    }

    static boolean isGlobal(int address) {
        for (var block : NON_GLOBAL) {
            if (block.contains(address)) return false;
        }
        return true;
    }

    static int mask(int prefixLength) {
        return prefixLength == 0 ? 0 : -1 << (32 - prefixLength);
    }

    private static Block block(int network, int prefixLength) {
        return new Block(network, mask(prefixLength));
    }

    private record Block(int network, int mask) {
        boolean contains(int address) {
            return (address & mask) == network;
        }
    }
}
