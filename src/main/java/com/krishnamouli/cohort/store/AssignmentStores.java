package com.krishnamouli.cohort.store;

import com.krishnamouli.cohort.config.CohortConfig;
import com.krishnamouli.cohort.config.CohortDefaults;
import com.krishnamouli.cohort.store.client.ClientState;
import com.krishnamouli.cohort.store.client.ClientStateAssignmentStore;
import com.krishnamouli.cohort.store.client.InMemoryClientState;
import com.krishnamouli.cohort.store.remote.RemoteAssignmentStore;

/**
 * Builds the assignment store selected by {@code storageBackend}.
 */
public final class AssignmentStores {

    private AssignmentStores() {
    }

    /**
     * Process-wide store. For the client backend this is a store over a
     * process-local {@link InMemoryClientState}; request handlers that own a
     * real client state bind it with {@link #forClient}.
     */
    public static AssignmentStore create(CohortConfig config) {
        switch (config.getStorageBackend()) {
            case EPHEMERAL:
                return new EphemeralAssignmentStore(
                        config.getStoreSegments(),
                        config.getMaxStoreEntries());
            case CLIENT:
                return forClient(new InMemoryClientState(), config);
            case REMOTE:
                return new RemoteAssignmentStore(
                        config.getRemoteHost(),
                        config.getRemotePort(),
                        config.getCookiePrefix(),
                        config.storeTimeout());
            default:
                throw new IllegalArgumentException("Unsupported storage backend: " + config.getStorageBackend());
        }
    }

    public static AssignmentStore forClient(ClientState state, CohortConfig config) {
        String prefix = config.getCookiePrefix() != null
                ? config.getCookiePrefix()
                : CohortDefaults.DEFAULT_COOKIE_PREFIX;
        return new ClientStateAssignmentStore(state, prefix);
    }
}
