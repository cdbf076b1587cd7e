package com.hydrokb.embedding;

@FunctionalInterface
public interface ProviderSwitchListener {
    void onProviderSwitch(ProviderDescriptor previous, ProviderDescriptor current);
}
