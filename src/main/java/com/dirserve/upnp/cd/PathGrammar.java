/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.dirserve.upnp.cd;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Parses object-IDs into {@link ObjectPath}s. Pure; performs no library lookups,
 * so a well-formed ID may still name an object that does not exist.
 *
 * <pre>
 * /a [ /ARTIST /l [ /ALBUM /t [ /TRACK ] ] ]
 * /l [ /ALBUM /t [ /TRACK ] ]
 * /g [ /GENRE /a [ /ARTIST /l [ /ALBUM /t [ /TRACK ] ] ] ]
 * /y [ /YEAR /l [ /ALBUM /t [ /TRACK ] ] ]
 * /n [ /ALBUM /t [ /TRACK ] ]
 * /m ( /FOLDER /m )* [ [ /FOLDER ] /t /TRACK ]
 * /p [ /PLAYLIST /t [ /TRACK ] ]
 * /t [ /TRACK ]
 * /v
 * /va [ /HASH ]
 * /ia [ /HASH ]
 * /il [ /ALBUM_NAME [ /HASH ] ]
 * /it [ /YYYY [ /MM [ /DD [ /HASH ] ] ] ]
 * /id [ /YYYY /MM /DD [ /HASH ] ]
 * </pre>
 */
public class PathGrammar {

    private static final Pattern NUMERIC = Pattern.compile("\\d+");
    private static final Pattern YEAR4 = Pattern.compile("\\d{4}");
    private static final Pattern TWO_DIGITS = Pattern.compile("\\d{2}");
    private static final Pattern HASH = Pattern.compile("[0-9a-f]{8}");
    private static final Pattern ANY = Pattern.compile("[^/]+");

    /** One segment of a shape: either a fixed literal or a typed key. */
    private record Step(String literal, PathKey key, Pattern pattern) {
        static Step lit(String literal) {
            return new Step(literal, null, null);
        }

        static Step key(PathKey key, Pattern pattern) {
            return new Step(null, key, pattern);
        }
    }

    /** A complete segment sequence and the node it names. */
    private record Shape(NodeType type, List<Step> steps) {}

    private static final Step ARTIST = Step.key(PathKey.ARTIST, NUMERIC);
    private static final Step ALBUM = Step.key(PathKey.ALBUM, NUMERIC);
    private static final Step GENRE = Step.key(PathKey.GENRE, NUMERIC);
    private static final Step TRACK = Step.key(PathKey.TRACK, NUMERIC);
    private static final Step PLAYLIST = Step.key(PathKey.PLAYLIST, NUMERIC);
    private static final Step MEDIA_HASH = Step.key(PathKey.HASH, HASH);
    private static final Step L = Step.lit("l");
    private static final Step T = Step.lit("t");
    private static final Step A = Step.lit("a");

    private static final Map<Mount, List<Shape>> SHAPES = new EnumMap<>(Mount.class);

    static {
        SHAPES.put(Mount.ARTISTS, List.of(
            new Shape(NodeType.ARTIST, List.of(ARTIST, L)),
            new Shape(NodeType.ALBUM, List.of(ARTIST, L, ALBUM, T)),
            new Shape(NodeType.TRACK, List.of(ARTIST, L, ALBUM, T, TRACK))));
        SHAPES.put(Mount.ALBUMS, albumShapes());
        SHAPES.put(Mount.NEW_MUSIC, albumShapes());
        SHAPES.put(Mount.GENRES, List.of(
            new Shape(NodeType.GENRE, List.of(GENRE, A)),
            new Shape(NodeType.ARTIST, List.of(GENRE, A, ARTIST, L)),
            new Shape(NodeType.ALBUM, List.of(GENRE, A, ARTIST, L, ALBUM, T)),
            new Shape(NodeType.TRACK, List.of(GENRE, A, ARTIST, L, ALBUM, T, TRACK))));
        Step year = Step.key(PathKey.YEAR, NUMERIC);
        SHAPES.put(Mount.YEARS, List.of(
            new Shape(NodeType.YEAR, List.of(year, L)),
            new Shape(NodeType.ALBUM, List.of(year, L, ALBUM, T)),
            new Shape(NodeType.TRACK, List.of(year, L, ALBUM, T, TRACK))));
        SHAPES.put(Mount.PLAYLISTS, List.of(
            new Shape(NodeType.PLAYLIST, List.of(PLAYLIST, T)),
            new Shape(NodeType.TRACK, List.of(PLAYLIST, T, TRACK))));
        SHAPES.put(Mount.TRACKS, List.of(
            new Shape(NodeType.TRACK, List.of(TRACK))));
        SHAPES.put(Mount.VIDEO_FOLDER, List.of());
        SHAPES.put(Mount.ALL_VIDEOS, List.of(
            new Shape(NodeType.VIDEO, List.of(MEDIA_HASH))));
        SHAPES.put(Mount.ALL_IMAGES, List.of(
            new Shape(NodeType.IMAGE, List.of(MEDIA_HASH))));
        Step imageAlbum = Step.key(PathKey.IMAGE_ALBUM, ANY);
        SHAPES.put(Mount.IMAGE_ALBUMS, List.of(
            new Shape(NodeType.IMAGE_ALBUM, List.of(imageAlbum)),
            new Shape(NodeType.IMAGE, List.of(imageAlbum, MEDIA_HASH))));
        Step y = Step.key(PathKey.YEAR, YEAR4);
        Step m = Step.key(PathKey.MONTH, TWO_DIGITS);
        Step d = Step.key(PathKey.DAY, TWO_DIGITS);
        SHAPES.put(Mount.IMAGE_TIMELINE, List.of(
            new Shape(NodeType.TIMELINE_YEAR, List.of(y)),
            new Shape(NodeType.TIMELINE_MONTH, List.of(y, m)),
            new Shape(NodeType.TIMELINE_DAY, List.of(y, m, d)),
            new Shape(NodeType.IMAGE, List.of(y, m, d, MEDIA_HASH))));
        SHAPES.put(Mount.IMAGE_DATES, List.of(
            new Shape(NodeType.DATE, List.of(y, m, d)),
            new Shape(NodeType.IMAGE, List.of(y, m, d, MEDIA_HASH))));
    }

    private static List<Shape> albumShapes() {
        return List.of(
            new Shape(NodeType.ALBUM, List.of(ALBUM, T)),
            new Shape(NodeType.TRACK, List.of(ALBUM, T, TRACK)));
    }

    public ObjectPath parse(String objectId) throws InvalidPathException {
        if (objectId == null || objectId.isEmpty()) {
            throw new InvalidPathException(String.valueOf(objectId), "empty");
        }

        Mount mount = Mount.forObjectId(objectId)
            .orElseThrow(() -> new InvalidPathException(objectId, "unknown prefix"));

        String rest = objectId.substring(mount.getPrefix().length());
        if (rest.isEmpty()) {
            return new ObjectPath(objectId, mount, NodeType.MOUNT_ROOT, Map.of());
        }

        String[] segments = rest.substring(1).split("/", -1);
        for (String segment : segments) {
            if (segment.isEmpty()) {
                throw new InvalidPathException(objectId, "empty segment");
            }
        }

        if (mount == Mount.MUSIC_FOLDER) {
            return parseFolder(objectId, segments);
        }

        for (Shape shape : SHAPES.get(mount)) {
            Map<PathKey, String> keys = match(objectId, shape, segments);
            if (keys != null) {
                return new ObjectPath(objectId, mount, shape.type(), keys);
            }
        }
        throw new InvalidPathException(objectId, "no " + mount.getPrefix() + " node has this shape");
    }

    private Map<PathKey, String> match(String objectId, Shape shape, String[] segments)
            throws InvalidPathException {
        if (shape.steps().size() != segments.length) {
            return null;
        }

        Map<PathKey, String> keys = new EnumMap<>(PathKey.class);
        for (int i = 0; i < segments.length; i++) {
            Step step = shape.steps().get(i);
            String segment = segments[i];
            if (step.literal() != null) {
                if (!step.literal().equals(segment)) {
                    return null;
                }
            } else if (step.pattern().matcher(segment).matches()) {
                keys.put(step.key(), step.key() == PathKey.IMAGE_ALBUM ? decode(objectId, segment) : segment);
            } else {
                return null;
            }
        }
        return keys;
    }

    // ( /FOLDER /m )* [ [ /FOLDER ] /t /TRACK ]
    private ObjectPath parseFolder(String objectId, String[] segments) throws InvalidPathException {
        Map<PathKey, String> keys = new EnumMap<>(PathKey.class);
        int i = 0;
        while (i + 1 < segments.length && NUMERIC.matcher(segments[i]).matches() && "m".equals(segments[i + 1])) {
            keys.put(PathKey.FOLDER, segments[i]);
            i += 2;
        }

        if (i == segments.length) {
            return new ObjectPath(objectId, Mount.MUSIC_FOLDER, NodeType.FOLDER, keys);
        }
        // Tracks of a folder replace its trailing /m with /t: /m/5/m lists /m/5/t/9
        if (i == 0 && segments.length == 2 && isTrackSuffix(segments, 0)) {
            keys.put(PathKey.TRACK, segments[1]);
            return new ObjectPath(objectId, Mount.MUSIC_FOLDER, NodeType.TRACK, keys);
        }
        if (i + 3 == segments.length && NUMERIC.matcher(segments[i]).matches() && isTrackSuffix(segments, i + 1)) {
            keys.put(PathKey.FOLDER, segments[i]);
            keys.put(PathKey.TRACK, segments[i + 2]);
            return new ObjectPath(objectId, Mount.MUSIC_FOLDER, NodeType.TRACK, keys);
        }
        throw new InvalidPathException(objectId, "malformed music folder path");
    }

    private static boolean isTrackSuffix(String[] segments, int at) {
        return "t".equals(segments[at]) && NUMERIC.matcher(segments[at + 1]).matches();
    }

    private static String decode(String objectId, String segment) throws InvalidPathException {
        try {
            return URLDecoder.decode(segment, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw new InvalidPathException(objectId, "bad album name encoding");
        }
    }
}
