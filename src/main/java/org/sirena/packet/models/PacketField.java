package org.sirena.packet.models;

/**
 * A bit range, both ends inclusive.
 */
public record PacketField(int start, int end, String label) {

    public int bits() {
        return end - start + 1;
    }
}
