package com.cratepilot.app.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.cratepilot.app.config.GenreProfileConfig;
import com.cratepilot.app.dto.spotify.AudioAnalysis;
import com.cratepilot.app.dto.spotify.AudioFeatures;
import com.cratepilot.app.dto.spotify.RawTrackRecord;
import com.cratepilot.app.dto.spotify.SpotifyAlbum;
import com.cratepilot.app.dto.spotify.SpotifyArtist;
import com.cratepilot.app.dto.spotify.SpotifyTrack;
import com.cratepilot.app.entity.FeatureSource;
import com.cratepilot.app.entity.SectionType;
import com.cratepilot.app.entity.Track;
import com.cratepilot.app.entity.TrackSection;
import com.cratepilot.app.exception.InvalidInputException;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class TrackNormalizerTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-01-15T10:00:00Z"), ZoneOffset.UTC);

    private final TrackNormalizer normalizer = new TrackNormalizer(
            new FeatureInferenceService(new GenreProfileConfig().genreProfiles(), new Random(7)), CLOCK);

    private static SpotifyTrack spotifyTrack() {
        return SpotifyTrack.builder()
                .id("4uLU6hMCjMI75M1A2tKUQC")
                .name("Strobe")
                .artists(List.of(new SpotifyArtist("a1", "deadmau5", null), new SpotifyArtist("a2", "Guest", null)))
                .album(new SpotifyAlbum("al1", "For Lack of a Better Name", "2009-09-22", "mau5trap"))
                .durationMs(637_500)
                .popularity(65)
                .build();
    }

    @Test
    @DisplayName("Provider features are rounded, scaled and converted to Camelot")
    void providerFeatures() {
        AudioFeatures features = AudioFeatures.builder().tempo(127.6).energy(0.61).key(9).mode(0).build();

        Track track = normalizer.normalize(RawTrackRecord.builder()
                .track(spotifyTrack()).features(features).searchContext("progressive house").build());

        assertThat(track.getId()).isEqualTo("spotify-4uLU6hMCjMI75M1A2tKUQC");
        assertThat(track.getArtist()).isEqualTo("deadmau5, Guest");
        assertThat(track.getGenre()).isEqualTo("house");
        assertThat(track.getDurationSec()).isEqualTo(638);
        assertThat(track.getBpm()).isEqualTo(128.0);
        assertThat(track.getEnergy()).isEqualTo(4);
        assertThat(track.getCamelotKey()).isEqualTo("8A");
        assertThat(track.getReleaseYear()).isEqualTo(2009);
        assertThat(track.getLabel()).isEqualTo("mau5trap");
        assertThat(track.getFeatureSource()).isEqualTo(FeatureSource.PROVIDER);
        assertThat(track.getRegisteredAt()).isEqualTo(LocalDateTime.of(2025, 1, 15, 10, 0));
    }

    @Test
    @DisplayName("Undetected provider key falls back to 8A")
    void undetectedKey() {
        AudioFeatures features = AudioFeatures.builder().tempo(124.0).energy(0.5).key(-1).mode(1).build();

        Track track = normalizer.normalize(RawTrackRecord.builder().track(spotifyTrack()).features(features).build());

        assertThat(track.getCamelotKey()).isEqualTo("8A");
        assertThat(track.getFeatureSource()).isEqualTo(FeatureSource.PROVIDER);
    }

    @Test
    @DisplayName("Missing features are inferred and flagged")
    void inferredFeatures() {
        Track track = normalizer.normalize(RawTrackRecord.builder().track(spotifyTrack()).searchContext("techno").build());

        assertThat(track.getFeatureSource()).isEqualTo(FeatureSource.INFERRED);
        assertThat(track.isFeaturesInferred()).isTrue();
        assertThat(track.getGenre()).isEqualTo("techno");
        assertThat(track.getBpm()).isBetween(125.0, 140.0);
        assertThat(track.getCamelotKey()).isIn("8A", "9A", "10A", "11A", "12A");
    }

    @Test
    @DisplayName("Genre stays empty when nothing hints at one")
    void unknownGenre() {
        SpotifyTrack anonymous = spotifyTrack();
        anonymous.setArtists(List.of(new SpotifyArtist("a", "Nobody", null)));

        assertThat(normalizer.normalize(RawTrackRecord.builder().track(anonymous).build()).getGenre()).isNull();
    }

    @Test
    @DisplayName("Record without id or title is rejected")
    void missingIdentity() {
        SpotifyTrack noId = spotifyTrack();
        noId.setId(null);
        SpotifyTrack noTitle = spotifyTrack();
        noTitle.setName(" ");

        assertThatThrownBy(() -> normalizer.normalize(RawTrackRecord.builder().track(noId).build()))
                .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> normalizer.normalize(RawTrackRecord.builder().track(noTitle).build()))
                .isInstanceOf(InvalidInputException.class);
    }

    @Test
    @DisplayName("Analysis sections map to intro, drops, breakdowns and outro")
    void sections() {
        List<TrackSection> sections = TrackNormalizer.mapSections(List.of(
                new AudioAnalysis.Section(0.0, 30.0, -12.0, 128.0),
                new AudioAnalysis.Section(30.0, 60.0, -4.0, 128.0),
                new AudioAnalysis.Section(90.0, 30.0, -14.0, 128.0),
                new AudioAnalysis.Section(120.0, 40.0, -3.0, 100.0),
                new AudioAnalysis.Section(160.0, 20.0, -7.0, 128.0),
                new AudioAnalysis.Section(180.0, 30.0, -9.0, 128.0)));

        assertThat(sections).extracting(TrackSection::getType).containsExactly(
                SectionType.INTRO, SectionType.DROP, SectionType.BREAKDOWN,
                SectionType.CHORUS, SectionType.VERSE, SectionType.OUTRO);
        assertThat(sections.get(1).getEndTime()).isEqualTo(90.0);
    }

    @Test
    @DisplayName("Energy scaling and id helpers")
    void helpers() {
        assertThat(TrackNormalizer.scaleEnergy(0.0)).isEqualTo(1);
        assertThat(TrackNormalizer.scaleEnergy(0.81)).isEqualTo(5);
        assertThat(TrackNormalizer.scaleEnergy(0.4)).isEqualTo(2);
        assertThat(TrackNormalizer.toExternalId("spotify-xyz")).isEqualTo("xyz");
        assertThat(TrackNormalizer.toExternalId("xyz")).isEqualTo("xyz");
        assertThat(TrackNormalizer.parseYear("19x")).isNull();
    }
}
