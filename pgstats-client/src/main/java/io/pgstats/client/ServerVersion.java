package io.pgstats.client;

/**
 * Major version of a PostgreSQL server.
 * <p>
 * Releases before 10 are identified by two numbers ({@code 9.6}); from 10 onwards the first number
 * alone is the major version and {@code minor} is always zero.
 */
public record ServerVersion(int major, int minor) implements Comparable<ServerVersion> {

    public static final ServerVersion V9_4 = new ServerVersion(9, 4);
    public static final ServerVersion V9_5 = new ServerVersion(9, 5);
    public static final ServerVersion V9_6 = new ServerVersion(9, 6);
    public static final ServerVersion V10 = new ServerVersion(10, 0);

    public ServerVersion {
        if (major < 0 || minor < 0) {
            throw new IllegalArgumentException("Negative version component: " + major + "." + minor);
        }
    }

    public static ServerVersion of(int major) {
        return new ServerVersion(major, 0);
    }

    public boolean isAtLeast(ServerVersion other) {
        return compareTo(other) >= 0;
    }

    public boolean isNewerThan(ServerVersion other) {
        return compareTo(other) > 0;
    }

    public boolean isOlderThan(ServerVersion other) {
        return compareTo(other) < 0;
    }

    @Override
    public int compareTo(ServerVersion other) {
        int result = Integer.compare(major, other.major);
        return result != 0 ? result : Integer.compare(minor, other.minor);
    }

    @Override
    public String toString() {
        return major >= 10 && minor == 0 ? Integer.toString(major) : major + "." + minor;
    }
}
