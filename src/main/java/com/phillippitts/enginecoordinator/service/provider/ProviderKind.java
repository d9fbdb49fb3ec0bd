package com.phillippitts.enginecoordinator.service.provider;

/** Where a provider runs. Local providers are free; cloud providers are billed per token. */
public enum ProviderKind {
    LOCAL,
    CLOUD
}
