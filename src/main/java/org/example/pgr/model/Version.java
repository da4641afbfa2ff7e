package org.example.pgr.model;

import org.apache.maven.artifact.versioning.ComparableVersion;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A semantic version: {@code major.minor.patch[-prerelease][+build]}.
 *
 * <p>Ordering uses Maven's {@link ComparableVersion} on the form without build metadata, so
 * pre-releases sort below the release they precede. Qualifiers Maven treats as the release
 * itself ({@code ga}, {@code final}, {@code release}) still make a distinct pre-release, ordered
 * just below it. Build metadata is kept for display only.</p>
 */
public final class Version implements Comparable<Version> {

    private static final Pattern PATTERN = Pattern.compile(
            "^v?(\\d+)(?:\\.(\\d+))?(?:\\.(\\d+))?(?:-([0-9A-Za-z.-]+))?(?:\\+([0-9A-Za-z.-]+))?$"
    );

    private final int major;
    private final int minor;
    private final int patch;
    private final String prerelease;
    private final String buildMetadata;
    private final ComparableVersion comparable;

    public Version(int major, int minor, int patch) {
        this(major, minor, patch, null, null);
    }

    private Version(int major, int minor, int patch, String prerelease, String buildMetadata) {
        if (major < 0 || minor < 0 || patch < 0) {
            throw new IllegalArgumentException("version components cannot be negative");
        }
        this.major = major;
        this.minor = minor;
        this.patch = patch;
        this.prerelease = prerelease;
        this.buildMetadata = buildMetadata;
        this.comparable = new ComparableVersion(withoutBuildMetadata());
    }

    /**
     * Parses a version string. A leading "v" is accepted, missing minor and patch default to 0.
     *
     * @throws IllegalArgumentException if the string is not a version
     */
    public static Version parse(String text) {
        Objects.requireNonNull(text, "version cannot be null");
        Matcher m = PATTERN.matcher(text.trim());
        if (!m.matches()) {
            throw new IllegalArgumentException("Invalid version: " + text);
        }
        return new Version(
                Integer.parseInt(m.group(1)),
                m.group(2) != null ? Integer.parseInt(m.group(2)) : 0,
                m.group(3) != null ? Integer.parseInt(m.group(3)) : 0,
                m.group(4),
                m.group(5)
        );
    }

    /**
     * Returns true if the string parses as a version.
     */
    public static boolean isValid(String text) {
        return text != null && PATTERN.matcher(text.trim()).matches();
    }

    public int getMajor() {
        return major;
    }

    public int getMinor() {
        return minor;
    }

    public int getPatch() {
        return patch;
    }

    public String getPrerelease() {
        return prerelease;
    }

    public boolean isPrerelease() {
        return prerelease != null;
    }

    /**
     * First version of the next major line, the exclusive upper bound of {@code from:} requirements.
     */
    public Version nextMajor() {
        return new Version(major + 1, 0, 0);
    }

    /**
     * First version of the next minor line.
     */
    public Version nextMinor() {
        return new Version(major, minor + 1, 0);
    }

    private String withoutBuildMetadata() {
        String core = major + "." + minor + "." + patch;
        return prerelease != null ? core + "-" + prerelease : core;
    }

    @Override
    public int compareTo(Version other) {
        int result = comparable.compareTo(other.comparable);
        if (result != 0 || Objects.equals(prerelease, other.prerelease)) {
            return result;
        }
        if (prerelease == null) {
            return 1;
        }
        if (other.prerelease == null) {
            return -1;
        }
        return prerelease.compareTo(other.prerelease);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Version version = (Version) o;
        return major == version.major &&
               minor == version.minor &&
               patch == version.patch &&
               Objects.equals(prerelease, version.prerelease);
    }

    @Override
    public int hashCode() {
        return Objects.hash(major, minor, patch, prerelease);
    }

    @Override
    public String toString() {
        String text = withoutBuildMetadata();
        return buildMetadata != null ? text + "+" + buildMetadata : text;
    }
}
