package com.williamcallahan.imagesearch.service;

import com.williamcallahan.imagesearch.domain.TagGroup;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import javax.imageio.ImageIO;
import org.springframework.stereotype.Component;

/**
 * Finds image files by extension, using the formats the installed ImageIO readers can decode.
 */
@Component
public class ImageDiscovery {

    private static final String DEFAULT_TAG = "images";

    private final Set<String> imageExtensions;

    public ImageDiscovery() {
        this.imageExtensions = Arrays.stream(ImageIO.getReaderFileSuffixes())
                .map(suffix -> suffix.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    /**
     * Reports whether the file name carries a decodable image extension.
     */
    public boolean isImage(Path file) {
        Path fileName = file.getFileName();
        if (fileName == null) {
            return false;
        }
        String name = fileName.toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 && imageExtensions.contains(name.substring(dot + 1).toLowerCase(Locale.ROOT));
    }

    /**
     * Recursively lists every image file under the root.
     *
     * @param root directory to walk
     * @return image files sorted by path
     * @throws IOException when the tree cannot be walked
     */
    public List<Path> findImages(Path root) throws IOException {
        Objects.requireNonNull(root, "root");
        if (!Files.isDirectory(root)) {
            throw new IllegalArgumentException("Not a directory: " + root);
        }
        try (Stream<Path> paths = Files.walk(root)) {
            return paths.filter(Files::isRegularFile).filter(this::isImage).sorted().toList();
        }
    }

    /**
     * Groups probe images by the folder that directly contains them.
     *
     * <p>A single image forms one group named after its parent folder. Folders sharing a name are
     * merged into one group.</p>
     *
     * @param input probe image or directory of probe folders
     * @return groups in path order, each with images ordered by file name
     * @throws IOException when the tree cannot be walked
     */
    public List<TagGroup> tagGroups(Path input) throws IOException {
        Objects.requireNonNull(input, "input");
        if (Files.isRegularFile(input)) {
            if (!isImage(input)) {
                throw new IllegalArgumentException("Not a supported image file: " + input);
            }
            return List.of(new TagGroup(folderName(input.getParent()), List.of(input)));
        }

        Map<String, List<Path>> imagesByTag = new LinkedHashMap<>();
        for (Path image : findImages(input)) {
            imagesByTag.computeIfAbsent(folderName(image.getParent()), tag -> new ArrayList<>()).add(image);
        }
        List<TagGroup> groups = new ArrayList<>(imagesByTag.size());
        imagesByTag.forEach((tag, images) -> {
            images.sort(Comparator.comparing((Path image) -> image.getFileName().toString()));
            groups.add(new TagGroup(tag, images));
        });
        return List.copyOf(groups);
    }

    private static String folderName(Path folder) {
        if (folder == null) {
            return DEFAULT_TAG;
        }
        Path name = folder.toAbsolutePath().getFileName();
        return name == null ? DEFAULT_TAG : name.toString();
    }
}
