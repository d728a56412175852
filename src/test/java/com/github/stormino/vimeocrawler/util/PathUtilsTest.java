package com.github.stormino.vimeocrawler.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PathUtils")
class PathUtilsTest {

    @Nested
    @DisplayName("sanitizeFilename")
    class SanitizeFilenameTests {

        @Test
        @DisplayName("should replace invalid characters with underscores")
        void shouldReplaceInvalidCharacters() {
            assertEquals("a_b_c_d_e_f_g_h_i_j", PathUtils.sanitizeFilename("a<b>c:d\"e/f\\g|h?i*j"));
            assertEquals("Don_t stop", PathUtils.sanitizeFilename("Don't stop"));
        }

        @Test
        @DisplayName("should strip trailing dots and whitespace")
        void shouldStripTrailingDots() {
            assertEquals("The End", PathUtils.sanitizeFilename("The End... \t"));
            assertEquals("  keep leading", PathUtils.sanitizeFilename("  keep leading"));
        }

        @ParameterizedTest
        @NullAndEmptySource
        @ValueSource(strings = {"   ", "\t"})
        @DisplayName("should return empty string for null, empty, or blank input")
        void shouldReturnEmptyForBlank(String input) {
            assertEquals("", PathUtils.sanitizeFilename(input));
        }
    }

    @Nested
    @DisplayName("buildVideoFileName")
    class BuildVideoFileNameTests {

        @Test
        @DisplayName("should combine title and lower-cased extension")
        void shouldCombineTitleAndExtension() {
            assertEquals("My Clip.mov", PathUtils.buildVideoFileName("My Clip", 42, "MOV"));
        }

        @Test
        @DisplayName("should fall back to video ID")
        void shouldFallBackToId() {
            assertEquals("42.mp4", PathUtils.buildVideoFileName("...", 42, "mp4"));
            assertEquals("42.none", PathUtils.buildVideoFileName(null, 42, "NONE"));
        }
    }

    @Nested
    @DisplayName("file name parts")
    class FileNamePartTests {

        @ParameterizedTest
        @CsvSource({
                "clip_hd.MP4, MP4",
                "archive.tar.gz, gz",
                "noextension, ''",
                "trailing., ''"
        })
        @DisplayName("should extract extension after last dot")
        void shouldExtractExtension(String name, String expected) {
            assertEquals(expected, PathUtils.getExtension(name));
        }

        @Test
        @DisplayName("should return empty extension for missing name")
        void shouldHandleMissingName() {
            assertEquals("", PathUtils.getExtension(null));
        }

        @Test
        @DisplayName("should take stem before first dot")
        void shouldTakeStem() {
            assertEquals("Clip.hd", PathUtils.getStem("Clip.hd.mp4"));
            assertEquals("Dr. Who", PathUtils.getStem("Dr. Who.mp4"));
            assertEquals("", PathUtils.getStem(".hidden"));
            assertNull(PathUtils.getStem("Clip (20)"));
        }
    }

    @Nested
    @DisplayName("filesystem")
    class FilesystemTests {

        @Test
        @DisplayName("should create nested directories")
        void shouldCreateNestedDirectories(@TempDir Path tempDir) {
            Path newDir = tempDir.resolve("new/nested/directory");

            assertTrue(PathUtils.createDirectoryStructure(newDir));
            assertTrue(Files.isDirectory(newDir));
            assertTrue(PathUtils.createDirectoryStructure(newDir));
        }

        @Test
        @DisplayName("should fail when a file is in the way")
        void shouldFailWhenFileInTheWay(@TempDir Path tempDir) throws IOException {
            Path file = Files.createFile(tempDir.resolve("blocker"));

            assertFalse(PathUtils.createDirectoryStructure(file.resolve("child")));
        }

        @Test
        @DisplayName("should report file size or null")
        void shouldReportFileSize(@TempDir Path tempDir) throws IOException {
            Path file = Files.write(tempDir.resolve("data.bin"), new byte[12]);

            assertEquals(12L, PathUtils.fileSize(file));
            assertNull(PathUtils.fileSize(tempDir.resolve("missing.bin")));
        }

        @Test
        @DisplayName("should write shortcut without videos suffix")
        void shouldWriteShortcut(@TempDir Path tempDir) throws IOException {
            Path shortcut = PathUtils.writeShortcutFile(tempDir, "https://vimeo.com/channels/staffpicks/videos");

            assertEquals(tempDir.resolve("source.url"), shortcut);
            assertEquals(List.of("[InternetShortcut]", "URL=https://vimeo.com/channels/staffpicks"),
                    Files.readAllLines(shortcut));
        }

        @Test
        @DisplayName("should strip only a trailing videos segment")
        void shouldStripOnlyTrailingVideos() {
            assertEquals("https://vimeo.com/someone", PathUtils.stripVideosSuffix("https://vimeo.com/someone/videos"));
            assertEquals("https://vimeo.com/videos/x", PathUtils.stripVideosSuffix("https://vimeo.com/videos/x"));
            assertEquals("https://vimeo.com/myvideos", PathUtils.stripVideosSuffix("https://vimeo.com/myvideos"));
        }
    }
}
