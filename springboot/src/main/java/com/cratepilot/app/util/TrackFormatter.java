package com.cratepilot.app.util;

import com.cratepilot.app.entity.Track;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Plain-text renderings of tracks and durations for model prompts and log lines.
 */
public final class TrackFormatter {

    private static final int CHARS_PER_TOKEN = 4;

    private TrackFormatter() {
    }

    public static String seedTracks(List<Track> tracks) {
        if (tracks.isEmpty()) {
            return "None provided";
        }
        return tracks.stream()
                .map(t -> "- " + t.getArtist() + " - " + t.getTitle()
                        + " (" + bpm(t) + " BPM, " + t.getCamelotKey() + ", Energy: " + energy(t) + ")")
                .collect(Collectors.joining("\n"));
    }

    public static String seedTrackIds(List<Track> tracks) {
        if (tracks.isEmpty()) {
            return "None";
        }
        return tracks.stream()
                .map(t -> t.getId() + ": " + t.getArtist() + " - " + t.getTitle())
                .collect(Collectors.joining("\n"));
    }

    public static String trackList(List<Track> tracks, boolean withDuration) {
        if (tracks.isEmpty()) {
            return "No tracks available";
        }
        return tracks.stream()
                .map(t -> t.getId() + ": " + t.getArtist() + " - " + t.getTitle() + " (" + bpm(t) + " BPM, "
                        + t.getCamelotKey() + (withDuration ? ", " + t.getDurationSec() + "s" : "")
                        + ", Energy: " + energy(t) + ")")
                .collect(Collectors.joining("\n"));
    }

    public static String crateTracks(List<Track> tracks, boolean withIds) {
        if (tracks.isEmpty()) {
            return "Empty crate";
        }
        return IntStream.range(0, tracks.size())
                .mapToObj(i -> {
                    Track t = tracks.get(i);
                    String prefix = (i + 1) + ". " + (withIds ? t.getId() + ": " : "");
                    return prefix + t.getArtist() + " - " + t.getTitle() + " (" + bpm(t) + " BPM, " + t.getCamelotKey()
                            + (withIds ? ", Energy: " + energy(t) : "") + ")";
                })
                .collect(Collectors.joining("\n"));
    }

    public static String keyList(List<String> keys) {
        if (keys.isEmpty()) {
            return "Any";
        }
        if (keys.size() > 6) {
            return String.join(", ", keys.subList(0, 6)) + ", and " + (keys.size() - 6) + " more";
        }
        return String.join(", ", keys);
    }

    /**
     * "2 hours" on exact hour boundaries, otherwise minutes.
     */
    public static String durationLong(int seconds) {
        int minutes = seconds / 60;
        int hours = minutes / 60;
        if (hours > 0 && minutes % 60 == 0) {
            return hours + " hour" + (hours > 1 ? "s" : "");
        }
        return minutes + " minute" + (minutes != 1 ? "s" : "");
    }

    public static String mmss(int seconds) {
        return String.format("%d:%02d", seconds / 60, seconds % 60);
    }

    /**
     * Cuts a rendered list at a line boundary so it stays within a rough token budget.
     */
    public static String truncate(String list, int maxTokens) {
        int limit = maxTokens * CHARS_PER_TOKEN;
        if (list.length() <= limit) {
            return list;
        }
        String cut = list.substring(0, limit);
        int lastNewline = cut.lastIndexOf('\n');
        return (lastNewline > 0 ? cut.substring(0, lastNewline) : cut) + "\n... (list truncated)";
    }

    private static String bpm(Track track) {
        Double bpm = track.getBpm();
        if (bpm == null) {
            return "?";
        }
        return bpm == Math.rint(bpm) ? String.valueOf(bpm.longValue()) : String.valueOf(bpm);
    }

    private static String energy(Track track) {
        return track.getEnergy() != null ? String.valueOf(track.getEnergy()) : "N/A";
    }
}
