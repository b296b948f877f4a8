package com.yoursp.dssp.modules.channel;

/**
 * Creates a new port for a binding. Ports are never shared between
 * bindings.
 */
public interface DsspPortFactory {

    DsspPort create(ChannelBinding binding);
}
