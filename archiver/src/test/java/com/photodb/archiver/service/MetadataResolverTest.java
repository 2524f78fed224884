package com.photodb.archiver.service;

import com.photodb.archiver.model.Coordinate;
import com.photodb.archiver.model.EmbeddedTags;
import com.photodb.archiver.model.MediaRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MetadataResolverTest {

    @TempDir
    Path tempDir;

    private EmbeddedTagReader tagReader;
    private ContainerMetadataReader containerReader;
    private LocationResolver locationResolver;
    private MetadataResolver resolver;

    @BeforeEach
    void setUp() {
        tagReader = mock(EmbeddedTagReader.class);
        containerReader = mock(ContainerMetadataReader.class);
        locationResolver = mock(LocationResolver.class);
        resolver = new MetadataResolver(tagReader, containerReader, locationResolver);
    }

    @Test
    void exifTimestampAndLocation() throws IOException {
        Path photo = Files.createFile(tempDir.resolve("IMG_1.jpg"));
        Coordinate coordinate = new Coordinate(10.5, -20.25);
        when(tagReader.read(photo)).thenReturn(Optional.of(
                new EmbeddedTags(LocalDateTime.of(2021, 6, 1, 14, 30, 5), coordinate)));
        when(locationResolver.resolve(coordinate)).thenReturn(Optional.of("Main St, Springfield, IL"));

        MediaRecord media = resolver.resolve(photo).orElseThrow();

        assertEquals("2021-06-01", media.getDate());
        assertEquals("2021", media.getYear());
        assertEquals(coordinate, media.getCoordinate());
        assertEquals("Main St, Springfield, IL", media.getLocation());
        verify(containerReader, never()).creationTime(any());
    }

    @Test
    void containerTimeWhenNoExifDate() throws IOException {
        Path video = Files.createFile(tempDir.resolve("clip.mov"));
        when(tagReader.read(video)).thenReturn(Optional.empty());
        when(containerReader.creationTime(video)).thenReturn(Optional.of(LocalDateTime.of(2018, 12, 31, 23, 59)));

        MediaRecord media = resolver.resolve(video).orElseThrow();

        assertEquals("2018-12-31", media.getDate());
        assertEquals("2018", media.getYear());
        assertNull(media.getLocation());
        verify(locationResolver, never()).resolve(any());
    }

    @Test
    void gpsWithoutDateStillGetsLocation() throws IOException {
        Path photo = Files.createFile(tempDir.resolve("gps-only.jpg"));
        Coordinate coordinate = new Coordinate(1.0, 2.0);
        when(tagReader.read(photo)).thenReturn(Optional.of(new EmbeddedTags(null, coordinate)));
        when(containerReader.creationTime(photo)).thenReturn(Optional.of(LocalDateTime.of(2020, 2, 29, 8, 0)));
        when(locationResolver.resolve(coordinate)).thenReturn(Optional.empty());

        MediaRecord media = resolver.resolve(photo).orElseThrow();

        assertEquals("2020-02-29", media.getDate());
        assertNull(media.getLocation());
    }

    @Test
    void fileTimesAsLastResort() throws IOException {
        Path file = Files.createFile(tempDir.resolve("scan.png"));
        LocalDateTime modified = LocalDateTime.of(2019, 3, 4, 12, 0);
        Files.setLastModifiedTime(file, FileTime.from(modified.atZone(ZoneId.systemDefault()).toInstant()));
        when(tagReader.read(file)).thenReturn(Optional.empty());
        when(containerReader.creationTime(file)).thenReturn(Optional.empty());

        MediaRecord media = resolver.resolve(file).orElseThrow();

        assertEquals("2019-03-04", media.getDate());
        assertEquals("2019", media.getYear());
    }

    @Test
    void noTimestampAtAllIsEmpty() {
        Path missing = tempDir.resolve("vanished.jpg");
        when(tagReader.read(missing)).thenReturn(Optional.empty());
        when(containerReader.creationTime(missing)).thenReturn(Optional.empty());

        assertTrue(resolver.resolve(missing).isEmpty());
    }
}
