package de.bsommerfeld.labreport.server.http;

import de.bsommerfeld.labreport.core.error.NotFoundException;
import io.netty.handler.codec.http.HttpMethod;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps method and path to a {@link RouteHandler}. Templates use
 * {@code {name}} placeholders for single path segments, e.g.
 * {@code /api/lab-reports/{reportId}/questions}.
 *
 * <p>
 * Routes are matched in registration order. A path that matches some
 * template but none with the requested method yields
 * {@link MethodNotAllowedException}; a path that matches nothing yields
 * {@link NotFoundException}.
 */
public class ApiRouter {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([a-zA-Z][a-zA-Z0-9]*)}");

    private final List<Route> routes = new ArrayList<>();

    /**
     * A registered route. {@code secured} routes require a bearer token.
     */
    public record Route(HttpMethod method, String template, Pattern pattern, List<String> paramNames,
            RouteHandler handler, boolean secured) {
    }

    /** A resolved route plus the values bound to its placeholders. */
    public record RouteMatch(Route route, Map<String, String> params) {
    }

    public ApiRouter publicRoute(HttpMethod method, String template, RouteHandler handler) {
        return add(method, template, handler, false);
    }

    public ApiRouter securedRoute(HttpMethod method, String template, RouteHandler handler) {
        return add(method, template, handler, true);
    }

    private ApiRouter add(HttpMethod method, String template, RouteHandler handler, boolean secured) {
        List<String> names = new ArrayList<>();
        Matcher m = PLACEHOLDER.matcher(template);
        StringBuilder regex = new StringBuilder("^");
        int last = 0;
        while (m.find()) {
            regex.append(Pattern.quote(template.substring(last, m.start())));
            regex.append("([^/]+)");
            names.add(m.group(1));
            last = m.end();
        }
        regex.append(Pattern.quote(template.substring(last))).append('$');
        routes.add(new Route(method, template, Pattern.compile(regex.toString()), List.copyOf(names),
                handler, secured));
        return this;
    }

    /**
     * @throws NotFoundException         if no template matches the path
     * @throws MethodNotAllowedException if templates match but not for
     *                                   {@code method}
     */
    public RouteMatch resolve(HttpMethod method, String path) {
        String normalized = path.length() > 1 && path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
        boolean pathMatched = false;
        for (Route route : routes) {
            Matcher m = route.pattern().matcher(normalized);
            if (!m.matches())
                continue;
            pathMatched = true;
            if (!route.method().equals(method))
                continue;
            Map<String, String> params = new LinkedHashMap<>();
            for (int i = 0; i < route.paramNames().size(); i++) {
                params.put(route.paramNames().get(i), m.group(i + 1));
            }
            return new RouteMatch(route, params);
        }
        if (pathMatched)
            throw new MethodNotAllowedException("Method " + method + " not allowed on " + normalized);
        throw new NotFoundException("No route for " + normalized);
    }
}
