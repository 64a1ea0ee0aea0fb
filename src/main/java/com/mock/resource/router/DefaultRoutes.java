package com.mock.resource.router;

import com.mock.resource.definition.TypeNames;
import com.mock.resource.query.QueryEngine;
import com.mock.resource.serialize.GraphSerializer;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Derives the collection/member routes of a type:
 * <ul>
 *   <li>{@code GET /books[.fmt][?query]} -- every book</li>
 *   <li>{@code GET /books/<id>[.fmt][?query]} -- the book with that id</li>
 * </ul>
 */
final class DefaultRoutes {

    private static final String FORMAT_AND_QUERY = "(?:\\.[A-Za-z0-9]+)?(?:\\?.*)?";

    private DefaultRoutes() {
    }

    static List<RouteRegistration> forType(String type, QueryEngine queryEngine, GraphSerializer serializer) {
        String collection = TypeNames.pluralize(type);
        Pattern collectionPattern = Pattern.compile("/" + Pattern.quote(collection) + FORMAT_AND_QUERY);
        Pattern memberPattern = Pattern.compile("/" + Pattern.quote(collection) + "/(\\d{1,9})" + FORMAT_AND_QUERY);

        RouteRegistration member = new RouteRegistration("GET", memberPattern,
                groups -> queryEngine.find(type, Integer.parseInt(groups[0])),
                RouteClass.DEFAULT);
        RouteRegistration all = new RouteRegistration("GET", collectionPattern,
                groups -> serializer.serialize(queryEngine.find(type), collection),
                RouteClass.DEFAULT);
        return List.of(member, all);
    }
}
