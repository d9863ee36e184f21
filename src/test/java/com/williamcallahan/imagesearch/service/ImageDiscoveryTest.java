package com.williamcallahan.imagesearch.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.imagesearch.domain.TagGroup;
import com.williamcallahan.imagesearch.testing.TestImages;
import java.awt.Color;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Verifies recursive image discovery and tag grouping of probe folders.
 */
class ImageDiscoveryTest {

    private final ImageDiscovery imageDiscovery = new ImageDiscovery();

    @TempDir
    Path tempDir;

    @Test
    void recognizesImageExtensionsCaseInsensitively() {
        assertTrue(imageDiscovery.isImage(Path.of("a.png")));
        assertTrue(imageDiscovery.isImage(Path.of("b.JPG")));
        assertFalse(imageDiscovery.isImage(Path.of("notes.txt")));
        assertFalse(imageDiscovery.isImage(Path.of("png")));
    }

    @Test
    void findsImagesRecursivelyAndIgnoresOtherFiles() throws IOException {
        Path top = TestImages.writeSolidPng(tempDir.resolve("top.png"), Color.RED);
        Path nested = TestImages.writeSolidPng(tempDir.resolve("a/b/nested.png"), Color.GREEN);
        Files.writeString(tempDir.resolve("a/readme.txt"), "not an image");

        List<Path> images = imageDiscovery.findImages(tempDir);

        assertEquals(List.of(nested, top), images);
    }

    @Test
    void rejectsNonDirectoryRoots() throws IOException {
        Path file = TestImages.writeSolidPng(tempDir.resolve("single.png"), Color.RED);

        assertThrows(IllegalArgumentException.class, () -> imageDiscovery.findImages(file));
    }

    @Test
    void groupsProbesByContainingFolder() throws IOException {
        Path catB = TestImages.writeSolidPng(tempDir.resolve("cats/b.png"), Color.RED);
        Path catA = TestImages.writeSolidPng(tempDir.resolve("cats/a.png"), Color.RED);
        Path dog = TestImages.writeSolidPng(tempDir.resolve("dogs/rex.png"), Color.BLUE);

        List<TagGroup> groups = imageDiscovery.tagGroups(tempDir);

        assertEquals(2, groups.size());
        assertEquals("cats", groups.get(0).tag());
        assertEquals(List.of(catA, catB), groups.get(0).images());
        assertEquals("dogs", groups.get(1).tag());
        assertEquals(List.of(dog), groups.get(1).images());
    }

    @Test
    void mergesFoldersSharingAName() throws IOException {
        Path first = TestImages.writeSolidPng(tempDir.resolve("2023/cats/one.png"), Color.RED);
        Path second = TestImages.writeSolidPng(tempDir.resolve("2024/cats/two.png"), Color.RED);

        List<TagGroup> groups = imageDiscovery.tagGroups(tempDir);

        assertEquals(1, groups.size());
        assertEquals(List.of(first, second), groups.get(0).images());
    }

    @Test
    void singleProbeFileIsTaggedWithItsParentFolder() throws IOException {
        Path probe = TestImages.writeSolidPng(tempDir.resolve("birds/robin.png"), Color.RED);

        List<TagGroup> groups = imageDiscovery.tagGroups(probe);

        assertEquals(List.of(new TagGroup("birds", List.of(probe))), groups);
    }

    @Test
    void rejectsSingleFilesThatAreNotImages() throws IOException {
        Path text = Files.writeString(tempDir.resolve("notes.txt"), "text");

        assertThrows(IllegalArgumentException.class, () -> imageDiscovery.tagGroups(text));
    }
}
