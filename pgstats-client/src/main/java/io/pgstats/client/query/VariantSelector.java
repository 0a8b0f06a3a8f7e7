package io.pgstats.client.query;

import io.pgstats.client.ServerVersion;
import io.pgstats.client.UnsupportedVersionException;

/**
 * Decision table mapping a server version to the query variant of each versioned view, and the
 * minimum version of each view that older servers do not have. All version comparisons live here.
 */
public final class VariantSelector {

    public static final ServerVersion PROGRESS_VACUUM_MIN_VERSION = ServerVersion.V9_6;
    public static final ServerVersion SSL_MIN_VERSION = ServerVersion.V9_5;
    public static final ServerVersion SUBSCRIPTION_MIN_VERSION = ServerVersion.V10;

    private VariantSelector() {}

    public static ActivityQuery activity(ServerVersion version) {
        if (version.isNewerThan(ServerVersion.V9_6)) {
            return ActivityQuery.NEW;
        }
        if (version.equals(ServerVersion.V9_6)) {
            return ActivityQuery.MID;
        }
        return ActivityQuery.OLD;
    }

    public static ReplicationQuery replication(ServerVersion version) {
        return version.isOlderThan(ServerVersion.V10) ? ReplicationQuery.OLD : ReplicationQuery.NEW;
    }

    public static StatementsQuery statements(ServerVersion version) {
        return version.isNewerThan(ServerVersion.V9_4) ? StatementsQuery.NEW : StatementsQuery.OLD;
    }

    public static WalReceiverQuery walReceiver(ServerVersion version) throws UnsupportedVersionException {
        if (version.isNewerThan(ServerVersion.V10)) {
            return WalReceiverQuery.NEWEST;
        }
        if (version.equals(ServerVersion.V10) || version.equals(ServerVersion.V9_6)) {
            return WalReceiverQuery.MID;
        }
        throw new UnsupportedVersionException(WalReceiverQuery.VIEW, version);
    }

    public static void requireAtLeast(String view, ServerVersion version, ServerVersion minimum)
            throws UnsupportedVersionException {
        if (version.isOlderThan(minimum)) {
            throw new UnsupportedVersionException(view, version);
        }
    }
}
