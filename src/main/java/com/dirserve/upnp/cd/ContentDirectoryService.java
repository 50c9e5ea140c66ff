/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.dirserve.upnp.cd;

import com.dirserve.library.LibraryException;
import com.dirserve.library.LibraryResult;
import com.dirserve.library.LibrarySearch;
import com.dirserve.library.MediaLibrary;
import com.dirserve.library.PageWindow;
import com.dirserve.library.SearchTable;
import com.dirserve.upnp.cd.StaticMenus.MenuEntry;
import com.dirserve.upnp.cd.StaticMenus.MenuPage;
import com.dirserve.upnp.cd.criteria.SearchCriteriaDecoder;
import com.dirserve.upnp.cd.criteria.SearchQuery;
import com.dirserve.upnp.cd.criteria.SortClause;
import com.dirserve.upnp.cd.criteria.SortCriteriaDecoder;
import com.dirserve.upnp.cd.criteria.UnsupportedCriteriaException;
import com.dirserve.upnp.cd.didl.DidlFilter;
import com.dirserve.upnp.cd.didl.DidlRenderer;
import com.dirserve.upnp.cd.didl.RenderRequest;
import com.dirserve.upnp.cd.didl.RenderedPage;
import com.dirserve.upnp.cd.event.ContentDirectoryState;
import com.dirserve.utils.LoggerUtil;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * The ContentDirectory:1 actions.
 *
 * <p>Faults: 701 for IDs that do not resolve, 708 for search and sort criteria
 * that cannot be decoded (and any Search backend failure), 720 for an invalid
 * BrowseFlag or a Browse backend failure.
 */
public class ContentDirectoryService {

    public static final String SEARCH_CAPABILITIES = "dc:title,dc:creator,upnp:artist,upnp:album,upnp:genre";
    public static final String SORT_CAPABILITIES =
        "dc:title,dc:creator,dc:date,upnp:artist,upnp:album,upnp:genre,upnp:originalTrackNumber";

    private final MediaLibrary library;
    private final ContentDirectoryState state;
    private final PathGrammar grammar;
    private final QueryTranslator translator;
    private final SearchCriteriaDecoder searchDecoder;
    private final SortCriteriaDecoder sortDecoder;
    private final DidlRenderer renderer;
    private final StaticMenus menus;

    public ContentDirectoryService(MediaLibrary library,
                                   ContentDirectoryState state,
                                   PathGrammar grammar,
                                   QueryTranslator translator,
                                   SearchCriteriaDecoder searchDecoder,
                                   SortCriteriaDecoder sortDecoder,
                                   DidlRenderer renderer,
                                   StaticMenus menus) {
        this.library = library;
        this.state = state;
        this.grammar = grammar;
        this.translator = translator;
        this.searchDecoder = searchDecoder;
        this.sortDecoder = sortDecoder;
        this.renderer = renderer;
        this.menus = menus;
    }

    public String getSearchCapabilities() {
        return SEARCH_CAPABILITIES;
    }

    public String getSortCapabilities() {
        return SORT_CAPABILITIES;
    }

    public long getSystemUpdateId() {
        return state.getSystemUpdateId();
    }

    public BrowseResult browse(BrowseRequest request) {
        BrowseFlag flag = BrowseFlag.fromWireName(request.browseFlag())
            .orElseThrow(() -> UpnpFault.cannotProcess("invalid BrowseFlag", null));
        String objectId = request.objectId() == null ? "" : request.objectId().trim();
        PageWindow page = PageWindow.of(request.startingIndex(), request.requestedCount());
        DidlFilter filter = DidlFilter.parse(request.filter());

        LoggerUtil.debug(() -> "[ContentDirectory] Browse " + objectId + " " + flag.getWireName()
            + " start=" + page.start() + " count=" + request.requestedCount() + " sort=" + request.sortCriteria());

        RenderedPage rendered = browseMenu(objectId, flag, page, request.sortCriteria())
            .orElseGet(() -> browseLibrary(objectId, flag, page, request.sortCriteria(), filter));

        return new BrowseResult(rendered.xml(), rendered.count(), rendered.total(), state.getSystemUpdateId());
    }

    public BrowseResult search(SearchRequest request) {
        if (!StaticMenus.ROOT_ID.equals(request.containerId() == null ? "" : request.containerId().trim())) {
            throw UpnpFault.unsupportedCriteria("only ContainerID 0 is supported");
        }
        PageWindow page = PageWindow.of(request.startingIndex(), request.requestedCount());
        DidlFilter filter = DidlFilter.parse(request.filter());

        SearchQuery query;
        try {
            query = searchDecoder.decode(request.searchCriteria());
        } catch (UnsupportedCriteriaException e) {
            LoggerUtil.warn("Unsupported search criteria '" + request.searchCriteria() + "': " + e.getMessage());
            throw UpnpFault.unsupportedCriteria(e.getMessage());
        }

        SortClause sort = sortDecoder.decode(request.sortCriteria(), query.table());
        if (request.sortCriteria() != null && !request.sortCriteria().isBlank() && sort.isEmpty()) {
            throw UpnpFault.unsupportedSort();
        }

        Set<Character> tags = new LinkedHashSet<>(query.tags());
        tags.addAll(sort.tags());
        if (query.table() == SearchTable.TRACKS) {
            // Rendered tracks always carry artist, album and genre
            tags.addAll(List.of(LibrarySearch.TAG_ARTIST, LibrarySearch.TAG_ALBUM, LibrarySearch.TAG_GENRE));
        }

        LibrarySearch search = new LibrarySearch(
            query.table(), query.predicate(), query.parameters(), sort.orderSql(), tags, page);

        LibraryResult result;
        try {
            result = library.search(search);
        } catch (LibraryException e) {
            LoggerUtil.error("Search failed for '" + request.searchCriteria() + "'", e);
            throw UpnpFault.unsupportedCriteria("search failed");
        }

        RenderedPage rendered = renderer.render(result,
            RenderRequest.listing(searchTemplate(query.table()), searchRoot(query.table()), filter));
        return new BrowseResult(rendered.xml(), rendered.count(), rendered.total(), state.getSystemUpdateId());
    }

    private Optional<RenderedPage> browseMenu(String objectId, BrowseFlag flag, PageWindow page, String sort) {
        if (flag == BrowseFlag.BROWSE_DIRECT_CHILDREN) {
            return menus.children(objectId)
                .map(entries -> renderer.renderMenu(StaticMenus.page(entries, sort, page)));
        }
        return menus.metadata(objectId)
            .map(entry -> renderer.renderMenu(new MenuPage(List.<MenuEntry>of(entry), 1)));
    }

    private RenderedPage browseLibrary(String objectId, BrowseFlag flag, PageWindow page, String sort,
                                       DidlFilter filter) {
        ObjectPath path;
        try {
            path = grammar.parse(objectId);
        } catch (InvalidPathException e) {
            LoggerUtil.warn(e.getMessage());
            throw UpnpFault.noSuchObject();
        }

        TranslatedQuery translated = translator.translate(path, flag, page, sort);
        if (!translated.hasQuery()) {
            return RenderedPage.EMPTY;
        }

        LibraryResult result;
        try {
            result = library.execute(translated.query());
        } catch (LibraryException e) {
            LoggerUtil.error("Browse failed for " + objectId, e);
            throw UpnpFault.cannotProcess(e.getMessage(), e);
        }

        RenderRequest renderRequest = flag == BrowseFlag.BROWSE_METADATA
            ? RenderRequest.describing(translated.template(), path, filter)
            : RenderRequest.listing(translated.template(), objectId, filter)
                .withTotalCap(translated.totalCap());
        if (translated.template() == RowTemplate.FOLDER) {
            renderRequest = renderRequest.withFolder(path);
        }

        RenderedPage rendered = renderer.render(result, renderRequest);
        if (flag == BrowseFlag.BROWSE_METADATA && rendered.count() == 0) {
            throw UpnpFault.noSuchObject();
        }
        return rendered;
    }

    /** Search results are named under the standalone mounts so their IDs resolve again. */
    private static String searchRoot(SearchTable table) {
        return switch (table) {
            case TRACKS -> Mount.TRACKS.getPrefix();
            case VIDEOS -> Mount.ALL_VIDEOS.getPrefix();
            case IMAGES -> Mount.ALL_IMAGES.getPrefix();
        };
    }

    private static RowTemplate searchTemplate(SearchTable table) {
        return switch (table) {
            case TRACKS -> RowTemplate.TRACK;
            case VIDEOS -> RowTemplate.VIDEO;
            case IMAGES -> RowTemplate.IMAGE;
        };
    }
}
