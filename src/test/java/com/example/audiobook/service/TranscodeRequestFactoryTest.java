package com.example.audiobook.service;

import com.example.audiobook.exception.TranscodeException;
import com.example.audiobook.utils.model.BookMetadata;
import com.example.audiobook.utils.model.ConversionContext;
import com.example.audiobook.utils.model.WorkItem;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Year;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TranscodeRequestFactoryTest {
    private final TranscodeRequestFactory factory = new TranscodeRequestFactory();

    @Test
    void testBuildTags_whenTitleAndAuthorAreKnown_shouldMapArtistAndGenre() {
        var context = new ConversionContext(workItem(), BookMetadata.builder()
                .title("T")
                .authors(List.of("A"))
                .build());

        var tags = factory.buildTags(context);

        assertEquals("T", tags.get("title"));
        assertEquals("A", tags.get("artist"));
        assertEquals("A", tags.get("album_artist"));
        assertEquals("Audiobook", tags.get("genre"));
        assertEquals("B0001", tags.get("grouping"));
    }

    @Test
    void testBuildTags_whenFullMetadataIsKnown_shouldMapEveryTag() {
        var context = new ConversionContext(workItem(), BookMetadata.builder()
                .title("The Way of Kings")
                .subtitle("Book One")
                .description("An epic.")
                .authors(List.of("Brandon Sanderson", "Second Author"))
                .narrators(List.of("Michael Kramer", "Kate Reading"))
                .publisher("Macmillan Audio")
                .seriesName("The Stormlight Archive")
                .seriesSequence("1")
                .releaseDate("2010-08-31")
                .language("english")
                .externalId("EXT-1")
                .build());

        var tags = factory.buildTags(context);

        assertEquals("An epic.\n\nSubtitle: Book One", tags.get("comment"));
        assertEquals("Brandon Sanderson, Second Author", tags.get("artist"));
        assertEquals("Michael Kramer, Kate Reading", tags.get("composer"));
        assertEquals("Macmillan Audio", tags.get("publisher"));
        assertEquals("©2010 Macmillan Audio;(P)2010 Macmillan Audio", tags.get("copyright"));
        assertEquals("The Stormlight Archive, Book 1", tags.get("album"));
        assertEquals("2010", tags.get("date"));
        assertEquals("english", tags.get("language"));
        assertEquals("EXT-1", tags.get("grouping"));
    }

    @Test
    void testBuildTags_whenReleaseDateIsUnknown_shouldUseCurrentYearForCopyright() {
        var year = Year.now().getValue();
        var context = new ConversionContext(workItem(), BookMetadata.builder()
                .title("T")
                .publisher("P")
                .seriesName("Series")
                .subtitle("Sub")
                .build());

        var tags = factory.buildTags(context);

        assertEquals("©" + year + " P;(P)" + year + " P", tags.get("copyright"));
        assertEquals("Series", tags.get("album"));
        assertEquals("Subtitle: Sub", tags.get("comment"));
        assertFalse(tags.containsKey("date"));
    }

    @Test
    void testBuildTags_whenMetadataIsAbsent_shouldReturnNoTags() {
        var tags = factory.buildTags(new ConversionContext(workItem(), null));

        assertTrue(tags.isEmpty());
    }

    @Test
    void testCreate_whenCoverArtIsGiven_shouldAttachCoverStream() throws Exception {
        var cover = Path.of("/staging/cover.jpg");
        var context = new ConversionContext(workItem(), BookMetadata.builder().title("T").build());

        var args = factory.create(context, cover).toArguments();

        assertEquals(List.of("-y", "-audible_key", "key", "-audible_iv", "iv",
                "-i", Path.of("/staging/B0001.aax").toString(),
                "-i", cover.toString(),
                "-metadata", "title=T",
                "-metadata", "grouping=B0001",
                "-metadata", "genre=Audiobook",
                "-map", "0:a",
                "-map", "1", "-disposition:v:0", "attached_pic", "-c:v", "mjpeg",
                "-c:a", "copy", Path.of("/staging/B0001.m4b").toString()), args);
    }

    @Test
    void testCreate_whenCoverArtIsAbsent_shouldDropVideoStreams() throws Exception {
        var context = new ConversionContext(workItem(), null);

        var args = factory.create(context, null).toArguments();

        assertTrue(args.contains("-vn"));
        assertFalse(args.contains("attached_pic"));
        assertFalse(args.contains("-metadata"));
        assertEquals(Path.of("/staging/B0001.m4b").toString(), args.get(args.size() - 1));
    }

    @Test
    void testCreate_whenIvIsBlank_shouldThrowTranscodeException() {
        var context = new ConversionContext(workItem().toBuilder().iv(" ").build(), null);

        var ex = assertThrows(TranscodeException.class, () -> factory.create(context, null));

        assertEquals("Missing decryption key material for B0001", ex.getMessage());
    }

    @Test
    void testExtractYear() {
        assertEquals("2021", TranscodeRequestFactory.extractYear("2021-03-04"));
        assertEquals(null, TranscodeRequestFactory.extractYear("21"));
    }

    static WorkItem workItem() {
        return WorkItem.builder()
                .itemId("B0001")
                .taskId("task-1")
                .title("T")
                .encryptedPath(Path.of("/staging/B0001.aax"))
                .decryptedPath(Path.of("/staging/B0001.m4b"))
                .destinationDirectory("/library")
                .key("key")
                .iv("iv")
                .totalBytes(1000)
                .build();
    }
}
