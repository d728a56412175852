package com.github.stormino.vimeocrawler.service;

import com.github.stormino.vimeocrawler.config.CrawlerProperties;
import com.github.stormino.vimeocrawler.exception.InvalidLinkException;
import com.github.stormino.vimeocrawler.model.FolderKind;
import com.github.stormino.vimeocrawler.model.LinkKind;
import com.github.stormino.vimeocrawler.model.LinkNode;
import com.github.stormino.vimeocrawler.model.LinkNode.AccountNode;
import com.github.stormino.vimeocrawler.model.LinkNode.CategoryNode;
import com.github.stormino.vimeocrawler.model.LinkNode.FolderNode;
import com.github.stormino.vimeocrawler.model.LinkNode.VideoNode;
import com.github.stormino.vimeocrawler.model.LinkNode.VideosListingNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LinkClassifier")
class LinkClassifierTest {

    private LinkClassifier classifier;

    @BeforeEach
    void setUp() {
        classifier = new LinkClassifier(new CrawlerProperties());
    }

    @Nested
    @DisplayName("videos")
    class VideoTests {

        @Test
        @DisplayName("should classify numeric path as video")
        void shouldClassifyNumericPathAsVideo() {
            LinkNode node = classifier.classify("https://vimeo.com/123456");

            assertEquals(LinkKind.VIDEO, node.getKind());
            assertEquals(123456L, ((VideoNode) node).getVideoId());
            assertEquals("https://vimeo.com/123456", node.getUrl());
        }

        @Test
        @DisplayName("should expand bare ID")
        void shouldExpandBareId() {
            LinkNode node = classifier.classify(" 123456 ");

            assertEquals(LinkKind.VIDEO, node.getKind());
            assertEquals("https://vimeo.com/123456", node.getUrl());
            assertEquals(" 123456 ", node.getRawInput());
        }

        @ParameterizedTest
        @ValueSource(strings = {
                "https://vimeo.com/channels/staffpicks/98765",
                "https://vimeo.com/someone/review/98765",
                "https://vimeo.com/someone/review/abc/98765",
                "https://vimeo.com/groups/shortfilms/videos/98765"
        })
        @DisplayName("should collapse share URLs ending in an ID")
        void shouldCollapseShareUrls(String link) {
            LinkNode node = classifier.classify(link);

            assertEquals(LinkKind.VIDEO, node.getKind());
            assertEquals(98765L, ((VideoNode) node).getVideoId());
            assertEquals("https://vimeo.com/98765", node.getUrl());
        }

        @Test
        @DisplayName("should ignore query string and fragment")
        void shouldIgnoreQueryAndFragment() {
            LinkNode node = classifier.classify("https://vimeo.com/123456?autoplay=1#t=30");

            assertEquals(LinkKind.VIDEO, node.getKind());
            assertEquals(123456L, ((VideoNode) node).getVideoId());
        }

        @Test
        @DisplayName("should treat overlong number as account name")
        void shouldTreatOverlongNumberAsAccount() {
            LinkNode node = classifier.classify("https://vimeo.com/12345678901234567890");

            assertEquals(LinkKind.ACCOUNT, node.getKind());
        }
    }

    @Nested
    @DisplayName("accounts and listings")
    class AccountTests {

        @Test
        @DisplayName("should classify single name as account")
        void shouldClassifySingleNameAsAccount() {
            LinkNode node = classifier.classify("https://vimeo.com/SomeOne/");

            assertEquals(LinkKind.ACCOUNT, node.getKind());
            assertEquals("someone", ((AccountNode) node).getAccountName());
            assertEquals("https://vimeo.com/SomeOne", node.getUrl());
        }

        @ParameterizedTest
        @ValueSource(strings = {"albums", "groups", "channels"})
        @DisplayName("should classify account folder lists as category")
        void shouldClassifyCategory(String category) {
            LinkNode node = classifier.classify("https://vimeo.com/someone/" + category);

            assertEquals(LinkKind.CATEGORY, node.getKind());
            assertEquals("someone", ((CategoryNode) node).getAccountName());
            assertEquals(category, ((CategoryNode) node).getCategoryName());
        }

        @Test
        @DisplayName("should classify account videos page as videos listing")
        void shouldClassifyVideosListing() {
            LinkNode node = classifier.classify("https://vimeo.com/someone/videos");

            assertEquals(LinkKind.VIDEOS_LISTING, node.getKind());
            assertEquals("someone", ((VideosListingNode) node).getAccountName());
            assertEquals("videos", ((VideosListingNode) node).getCategoryName());
        }

        @Test
        @DisplayName("should collapse duplicate slashes")
        void shouldCollapseDuplicateSlashes() {
            LinkNode node = classifier.classify("https://vimeo.com//someone//albums");

            assertEquals(LinkKind.CATEGORY, node.getKind());
            assertEquals("https://vimeo.com/someone/albums", node.getUrl());
        }

        @Test
        @DisplayName("should classify other account pages as generic")
        void shouldClassifyGeneric() {
            assertEquals(LinkKind.GENERIC, classifier.classify("https://vimeo.com/someone/likes").getKind());
            assertEquals(LinkKind.GENERIC, classifier.classify("https://vimeo.com/a/b/c/d/e").getKind());
        }
    }

    @Nested
    @DisplayName("folders")
    class FolderTests {

        @Test
        @DisplayName("should suffix channel URL with videos")
        void shouldSuffixChannel() {
            LinkNode node = classifier.classify("https://vimeo.com/channels/staffpicks");

            assertEquals(LinkKind.FOLDER, node.getKind());
            assertEquals(FolderKind.CHANNEL, ((FolderNode) node).getFolderKind());
            assertEquals("staffpicks", ((FolderNode) node).getDisplayName());
            assertEquals("https://vimeo.com/channels/staffpicks/videos", node.getUrl());
        }

        @Test
        @DisplayName("should not suffix album URL")
        void shouldNotSuffixAlbum() {
            LinkNode node = classifier.classify("https://vimeo.com/album/4242");

            assertEquals(LinkKind.FOLDER, node.getKind());
            assertEquals(FolderKind.ALBUM, ((FolderNode) node).getFolderKind());
            assertEquals("https://vimeo.com/album/4242", node.getUrl());
        }

        @Test
        @DisplayName("should not suffix twice")
        void shouldNotSuffixTwice() {
            LinkNode node = classifier.classify("https://vimeo.com/groups/shortfilms/videos");

            assertEquals(LinkKind.FOLDER, node.getKind());
            assertEquals(FolderKind.GROUP, ((FolderNode) node).getFolderKind());
            assertEquals("https://vimeo.com/groups/shortfilms/videos", node.getUrl());
        }
    }

    @Nested
    @DisplayName("system pages")
    class SystemTests {

        @ParameterizedTest
        @ValueSource(strings = {
                "https://vimeo.com",
                "https://vimeo.com/",
                "https://vimeo.com/help",
                "https://vimeo.com/help/faq",
                "https://vimeo.com/channels",
                "https://vimeo.com/log_in"
        })
        @DisplayName("should classify site pages as system")
        void shouldClassifySystem(String link) {
            assertEquals(LinkKind.SYSTEM, classifier.classify(link).getKind());
        }
    }

    @Nested
    @DisplayName("validation and identity")
    class IdentityTests {

        @Test
        @DisplayName("should reject links to other sites")
        void shouldRejectOtherSites() {
            InvalidLinkException e = assertThrows(InvalidLinkException.class,
                    () -> classifier.classify("https://example.com/123456"));
            assertEquals("https://example.com/123456", e.getLink());
        }

        @Test
        @DisplayName("should compare nodes by normalized URL")
        void shouldCompareByNormalizedUrl() {
            LinkNode bare = classifier.classify("123456");
            LinkNode full = classifier.classify("https://vimeo.com/123456/");

            assertEquals(bare, full);
            assertEquals(bare.hashCode(), full.hashCode());
            assertNotEquals(bare, classifier.classify("https://vimeo.com/654321"));
        }

        @ParameterizedTest
        @ValueSource(strings = {
                "123456",
                "https://vimeo.com/someone",
                "https://vimeo.com/someone/albums",
                "https://vimeo.com/someone/videos",
                "https://vimeo.com/channels/staffpicks",
                "https://vimeo.com/album/4242",
                "https://vimeo.com/channels/staffpicks/98765",
                "https://vimeo.com/help",
                "https://vimeo.com/someone/likes"
        })
        @DisplayName("should classify its own output identically")
        void shouldBeIdempotent(String link) {
            LinkNode first = classifier.classify(link);
            LinkNode second = classifier.classify(first.getUrl());

            assertEquals(first.getKind(), second.getKind());
            assertEquals(first.getUrl(), second.getUrl());
            assertEquals(first, second);
            if (first instanceof FolderNode) {
                assertEquals(((FolderNode) first).getFolderKind(), ((FolderNode) second).getFolderKind());
                assertEquals(((FolderNode) first).getDisplayName(), ((FolderNode) second).getDisplayName());
            }
            if (first instanceof VideoNode) {
                assertEquals(((VideoNode) first).getVideoId(), ((VideoNode) second).getVideoId());
            }
        }

        @Test
        @DisplayName("should build video URL from ID")
        void shouldBuildVideoUrl() {
            assertEquals("https://vimeo.com/42", classifier.videoUrl(42));
        }
    }
}
