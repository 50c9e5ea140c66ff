/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.dirserve.upnp.cd.didl;

import com.dirserve.library.LibraryResult;
import com.dirserve.library.LibraryRows.AlbumRow;
import com.dirserve.library.LibraryRows.ArtistRow;
import com.dirserve.library.LibraryRows.FolderRow;
import com.dirserve.library.LibraryRows.GenreRow;
import com.dirserve.library.LibraryRows.ImageGroupRow;
import com.dirserve.library.LibraryRows.ImageRow;
import com.dirserve.library.LibraryRows.LibraryRow;
import com.dirserve.library.LibraryRows.PlaylistRow;
import com.dirserve.library.LibraryRows.TrackRow;
import com.dirserve.library.LibraryRows.VideoRow;
import com.dirserve.library.LibraryRows.YearRow;
import com.dirserve.library.MediaLibrary;
import com.dirserve.upnp.cd.RowTemplate;
import com.dirserve.upnp.cd.StaticMenus.MenuEntry;
import com.dirserve.upnp.cd.StaticMenus.MenuPage;
import com.dirserve.utils.LoggerUtil;
import org.jupnp.support.contentdirectory.DIDLParser;
import org.jupnp.support.model.DIDLContent;
import org.jupnp.support.model.DIDLObject;
import org.jupnp.support.model.DescMeta;
import org.jupnp.support.model.PersonWithRole;
import org.jupnp.support.model.Protocol;
import org.jupnp.support.model.ProtocolInfo;
import org.jupnp.support.model.Res;
import org.jupnp.support.model.container.Container;
import org.jupnp.support.model.item.Item;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.net.URI;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.dirserve.utils.XmlUtils.secsToHms;

/**
 * Renders library rows and static menus as DIDL-Lite.
 *
 * <p>In listing mode each row becomes a child of the browsed ID, named
 * {@code <browsed>/<key>[/<suffix>]}. In describe mode the single row is the browsed
 * node itself. Music folder listings splice in full track details, fetched in one
 * batch, for the track entries of the folder.
 *
 * <p>Timestamps ({@code pv:modificationTime}, {@code pv:addedTime},
 * {@code pv:lastUpdated}) travel in a {@code desc} block of the pv namespace.
 */
public class DidlRenderer {

    static final String PV_NAMESPACE = "http://www.pv.com/pvns/";
    static final String UNKNOWN_YEAR = "Unknown";

    private static final String DEFAULT_MIME_TYPE = "application/octet-stream";
    private static final DateTimeFormatter DATE = DateTimeFormatter.ISO_LOCAL_DATE.withZone(ZoneOffset.UTC);
    private static final DateTimeFormatter DATE_TIME =
        DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss").withZone(ZoneOffset.UTC);

    private final MediaLibrary library;
    private final String baseUrl;
    private final DIDLParser parser = new DIDLParser();

    /**
     * @param baseUrl absolute URL media and artwork links are built from
     */
    public DidlRenderer(MediaLibrary library, String baseUrl) {
        this.library = library;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    public RenderedPage render(LibraryResult result, RenderRequest request) {
        DIDLContent didl = new DIDLContent();
        int total = Math.min(result.count(), request.totalCap());

        if (request.template() == RowTemplate.FOLDER && !request.describe()) {
            total += addFolder(didl, result.rows(), request);
        } else {
            for (LibraryRow row : result.rows()) {
                if (!addRow(didl, row, request)) {
                    LoggerUtil.warn("Row " + row + " does not fit template " + request.template());
                    total--;
                }
            }
        }

        return finish(didl, total);
    }

    /**
     * Renders a page of static menu containers.
     */
    public RenderedPage renderMenu(MenuPage page) {
        DIDLContent didl = new DIDLContent();
        for (MenuEntry entry : page.entries()) {
            Container container = container(entry.id(), entry.parentId(), entry.title(), "object.container");
            container.setSearchable(entry.searchable());
            didl.addContainer(container);
        }
        return finish(didl, page.total());
    }

    private RenderedPage finish(DIDLContent didl, int total) {
        int count = (int) didl.getCount();
        if (count == 0) {
            return new RenderedPage("", 0, total);
        }
        try {
            return new RenderedPage(parser.generate(didl), count, Math.max(total, count));
        } catch (Exception e) {
            throw new IllegalStateException("Cannot generate DIDL-Lite: " + e.getMessage(), e);
        }
    }

    // ==================== Rows ====================

    private boolean addRow(DIDLContent didl, LibraryRow row, RenderRequest request) {
        RowTemplate template = request.template();
        DidlFilter filter = request.filter();

        switch (template) {
            case ARTIST -> {
                if (!(row instanceof ArtistRow artist)) return false;
                didl.addContainer(rowContainer(request, String.valueOf(artist.id()), artist.artist()));
            }
            case ALBUM -> {
                if (!(row instanceof AlbumRow album)) return false;
                Container container = rowContainer(request, String.valueOf(album.id()), album.album());
                albumDetails(container, album, filter);
                didl.addContainer(container);
            }
            case GENRE -> {
                if (!(row instanceof GenreRow genre)) return false;
                didl.addContainer(rowContainer(request, String.valueOf(genre.id()), genre.genre()));
            }
            case YEAR -> {
                if (!(row instanceof YearRow year)) return false;
                didl.addContainer(rowContainer(request, String.valueOf(year.year()),
                    year.year() == 0 ? UNKNOWN_YEAR : String.valueOf(year.year())));
            }
            case FOLDER -> {
                if (!(row instanceof FolderRow folder)) return false;
                didl.addContainer(rowContainer(request, String.valueOf(folder.id()), folder.filename()));
            }
            case PLAYLIST -> {
                if (!(row instanceof PlaylistRow playlist)) return false;
                didl.addContainer(rowContainer(request, String.valueOf(playlist.id()), playlist.playlist()));
            }
            case IMAGE_GROUP -> {
                if (!(row instanceof ImageGroupRow group)) return false;
                didl.addContainer(rowContainer(request, group.id(), group.title()));
            }
            case TRACK -> {
                if (!(row instanceof TrackRow track)) return false;
                didl.addItem(trackItem(nodeId(request, String.valueOf(track.id())), parentId(request), track, filter));
            }
            case VIDEO -> {
                if (!(row instanceof VideoRow video)) return false;
                didl.addItem(videoItem(nodeId(request, video.hash()), parentId(request), video, filter));
            }
            case IMAGE -> {
                if (!(row instanceof ImageRow image)) return false;
                didl.addItem(imageItem(nodeId(request, image.hash()), parentId(request), image, filter));
            }
        }
        return true;
    }

    /**
     * Adds the folder's entries and returns how much the reported total shrinks
     * by entries that cannot be shown.
     */
    private int addFolder(DIDLContent didl, List<LibraryRow> rows, RenderRequest request) {
        int adjustment = 0;
        List<Long> trackIds = new ArrayList<>();

        for (LibraryRow row : rows) {
            if (!(row instanceof FolderRow folder)) {
                LoggerUtil.warn("Unexpected row in music folder listing: " + row);
                adjustment--;
                continue;
            }
            switch (folder.type()) {
                case FolderRow.TYPE_TRACK -> trackIds.add(folder.id());
                case FolderRow.TYPE_PLAYLIST -> {
                    // Playlist files inside folders are not browsable yet
                    LoggerUtil.warn("Skipping playlist entry in music folder: " + folder.filename());
                    adjustment--;
                }
                default -> addRow(didl, folder, request);
            }
        }

        if (trackIds.isEmpty()) {
            return adjustment;
        }
        if (request.folder() == null) {
            throw new IllegalStateException("Music folder listing of " + request.objectId() + " has no folder path");
        }

        Map<Long, TrackRow> tracks = library.trackDetails(trackIds);
        for (Long trackId : trackIds) {
            TrackRow track = tracks.get(trackId);
            if (track == null) {
                LoggerUtil.warn("Music folder " + request.objectId() + " lists missing track " + trackId);
                adjustment--;
                continue;
            }
            didl.addItem(trackItem(request.folder().folderTrackId(trackId), request.objectId(), track, request.filter()));
        }
        return adjustment;
    }

    private static String nodeId(RenderRequest request, String key) {
        if (request.describe()) {
            return request.objectId();
        }
        String suffix = request.template().getChildSuffix();
        return suffix == null
            ? request.objectId() + "/" + key
            : request.objectId() + "/" + key + "/" + suffix;
    }

    private static String parentId(RenderRequest request) {
        return request.describe() ? request.parentId() : request.objectId();
    }

    private static Container rowContainer(RenderRequest request, String key, String title) {
        return container(nodeId(request, key), parentId(request), title, request.template().getUpnpClass());
    }

    private static Container container(String id, String parentId, String title, String upnpClass) {
        Container container = new Container();
        container.setClazz(new DIDLObject.Class(upnpClass));
        container.setId(id);
        container.setParentID(parentId);
        container.setTitle(title);
        container.setRestricted(true);
        container.setSearchable(false);
        return container;
    }

    private static Item item(String id, String parentId, String title, RowTemplate template) {
        Item item = new Item();
        item.setClazz(new DIDLObject.Class(template.getUpnpClass()));
        item.setId(id);
        item.setParentID(parentId);
        item.setTitle(title);
        item.setRestricted(true);
        return item;
    }

    // ==================== Details ====================

    private void albumDetails(Container container, AlbumRow album, DidlFilter filter) {
        if (album.artist() != null) {
            if (filter.includes("dc:creator")) container.setCreator(album.artist());
            if (filter.includes("upnp:artist")) {
                container.addProperty(new DIDLObject.Property.UPNP.ARTIST(new PersonWithRole(album.artist())));
            }
        }
        if (album.year() > 0 && filter.includes("dc:date")) {
            // DLNA wants a full date
            container.addProperty(new DIDLObject.Property.DC.DATE(album.year() + "-01-01"));
        }
        if (album.artworkTrackId() != null && filter.includes("upnp:albumArtURI")) {
            container.addProperty(albumArt(baseUrl + "/music/" + album.artworkTrackId() + "/cover"));
        }
    }

    private Item trackItem(String id, String parentId, TrackRow track, DidlFilter filter) {
        Item item = item(id, parentId, track.title(), RowTemplate.TRACK);

        if (track.artist() != null) {
            if (filter.includes("dc:creator")) item.setCreator(track.artist());
            if (filter.includes("upnp:artist")) {
                item.addProperty(new DIDLObject.Property.UPNP.ARTIST(new PersonWithRole(track.artist())));
            }
        }
        if (track.album() != null && filter.includes("upnp:album")) {
            item.addProperty(new DIDLObject.Property.UPNP.ALBUM(track.album()));
        }
        if (track.genre() != null && filter.includes("upnp:genre")) {
            item.addProperty(new DIDLObject.Property.UPNP.GENRE(track.genre()));
        }
        if (track.tracknum() != null && filter.includes("upnp:originalTrackNumber")) {
            item.addProperty(new DIDLObject.Property.UPNP.ORIGINAL_TRACK_NUMBER(track.tracknum()));
        }
        if (track.year() > 0 && filter.includes("dc:date")) {
            item.addProperty(new DIDLObject.Property.DC.DATE(track.year() + "-01-01"));
        }
        if (track.artworkTrackId() != null && filter.includes("upnp:albumArtURI")) {
            item.addProperty(albumArt(baseUrl + "/music/" + track.artworkTrackId() + "/cover"));
        }
        timestamps(item, filter, track.timestamp(), track.addedTime(), track.updatedTime());

        Res res = res(track.contentType(), baseUrl + "/music/" + track.id() + "/download");
        if (track.filesize() != null && filter.includes("res@size")) {
            res.setSize(track.filesize());
        }
        if (track.secs() != null && filter.includes("res@duration")) {
            res.setDuration(secsToHms(track.secs()));
        }
        if (track.bitrate() != null && filter.includes("res@bitrate")) {
            // res@bitrate is in bytes per second
            res.setBitrate((long) (track.bitrate() / 8));
        }
        if (track.samplerate() != null && filter.includes("res@sampleFrequency")) {
            res.setSampleFrequency(track.samplerate().longValue());
        }
        item.addResource(res);
        return item;
    }

    private Item videoItem(String id, String parentId, VideoRow video, DidlFilter filter) {
        Item item = item(id, parentId, video.title(), RowTemplate.VIDEO);

        if (video.album() != null && filter.includes("upnp:album")) {
            item.addProperty(new DIDLObject.Property.UPNP.ALBUM(video.album()));
        }
        if (video.mtime() > 0 && filter.includes("dc:date")) {
            item.addProperty(new DIDLObject.Property.DC.DATE(DATE.format(Instant.ofEpochSecond(video.mtime()))));
        }
        if (filter.includes("upnp:albumArtURI")) {
            item.addProperty(albumArt(baseUrl + "/video/" + video.hash() + "/cover_300x300_o"));
        }
        timestamps(item, filter, video.mtime(), 0, video.updatedTime());

        Res res = res(video.mimeType(), baseUrl + "/video/" + video.hash() + "/download");
        if (video.filesize() != null && filter.includes("res@size")) {
            res.setSize(video.filesize());
        }
        if (video.secs() != null && filter.includes("res@duration")) {
            res.setDuration(secsToHms(video.secs()));
        }
        if (video.width() != null && video.height() != null && filter.includes("res@resolution")) {
            res.setResolution(video.width() + "x" + video.height());
        }
        item.addResource(res);
        return item;
    }

    private Item imageItem(String id, String parentId, ImageRow image, DidlFilter filter) {
        Item item = item(id, parentId, image.title(), RowTemplate.IMAGE);

        if (image.album() != null && filter.includes("upnp:album")) {
            item.addProperty(new DIDLObject.Property.UPNP.ALBUM(image.album()));
        }
        if (image.originalTime() > 0 && filter.includes("dc:date")) {
            item.addProperty(new DIDLObject.Property.DC.DATE(
                DATE_TIME.format(Instant.ofEpochSecond(image.originalTime()))));
        }
        if (filter.includes("upnp:albumArtURI")) {
            item.addProperty(albumArt(baseUrl + "/image/" + image.hash() + "/cover_300x300_o"));
        }
        timestamps(item, filter, image.mtime(), 0, image.updatedTime());

        Res res = res(image.mimeType(), baseUrl + "/image/" + image.hash() + "/download");
        if (image.filesize() != null && filter.includes("res@size")) {
            res.setSize(image.filesize());
        }
        if (image.width() != null && image.height() != null && filter.includes("res@resolution")) {
            res.setResolution(image.width() + "x" + image.height());
        }
        item.addResource(res);
        return item;
    }

    private static DIDLObject.Property.UPNP.ALBUM_ART_URI albumArt(String url) {
        return new DIDLObject.Property.UPNP.ALBUM_ART_URI(URI.create(url));
    }

    private static Res res(String mimeType, String url) {
        String mime = mimeType == null || mimeType.isBlank() ? DEFAULT_MIME_TYPE : mimeType;
        return new Res(new ProtocolInfo(Protocol.HTTP_GET, ProtocolInfo.WILDCARD, mime, ProtocolInfo.WILDCARD),
            null, url);
    }

    private static void timestamps(Item item, DidlFilter filter, long modified, long added, long updated) {
        DescMeta<Document> pv = new DescMeta<>("pv", null, URI.create(PV_NAMESPACE), null);
        Document metadata = pv.createMetadataDocument();
        Element wrapper = metadata.getDocumentElement();

        if (modified > 0 && filter.includes("pv:modificationTime")) {
            wrapper.appendChild(pvElement(metadata, "pv:modificationTime", modified));
        }
        if (added > 0 && filter.includes("pv:addedTime")) {
            wrapper.appendChild(pvElement(metadata, "pv:addedTime", added));
        }
        if (updated > 0 && filter.includes("pv:lastUpdated")) {
            wrapper.appendChild(pvElement(metadata, "pv:lastUpdated", updated));
        }

        if (wrapper.hasChildNodes()) {
            pv.setMetadata(metadata);
            item.addDescMetadata(pv);
        }
    }

    private static Element pvElement(Document metadata, String name, long value) {
        Element element = metadata.createElementNS(PV_NAMESPACE, name);
        element.setTextContent(String.valueOf(value));
        return element;
    }
}
