package com.agentstrike.scanner;

import com.agentstrike.model.TrafficContext;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InjectionPointTest {

    private static TrafficContext get() {
        return TrafficContext.builder("https://a.example.com/api/users?id=5&q=hi%20there")
                .requestId("base-1")
                .requestHeader("Host", "a.example.com")
                .requestHeader("Cookie", "sid=abc; theme=dark")
                .statusCode(200)
                .responseBody("<html>users</html>")
                .build();
    }

    private static TrafficContext jsonPost() {
        return TrafficContext.builder("https://a.example.com/api/profile")
                .method("POST")
                .requestHeader("Content-Type", "application/json")
                .requestBody("{\"name\":\"bob\",\"age\":3,\"nested\":{\"a\":1}}")
                .build();
    }

    @Test
    void extracts_every_point_kind_in_order() {
        List<InjectionPoint> points = InjectionPoints.extract(get());

        assertEquals(List.of(
                new InjectionPoint("id", InjectionType.URL_PARAM, "5"),
                new InjectionPoint("q", InjectionType.URL_PARAM, "hi there"),
                new InjectionPoint("sid", InjectionType.COOKIE, "abc"),
                new InjectionPoint("theme", InjectionType.COOKIE, "dark"),
                new InjectionPoint("User-Agent", InjectionType.HEADER, ""),
                new InjectionPoint("Referer", InjectionType.HEADER, ""),
                new InjectionPoint("X-Forwarded-For", InjectionType.HEADER, ""),
                new InjectionPoint("X-Forwarded-Host", InjectionType.HEADER, ""),
                new InjectionPoint("0", InjectionType.PATH, "api"),
                new InjectionPoint("1", InjectionType.PATH, "users")), points);
    }

    @Test
    void json_bodies_yield_top_level_primitive_fields_only() {
        List<InjectionPoint> points = InjectionPoints.extract(jsonPost());

        assertTrue(points.contains(new InjectionPoint("name", InjectionType.JSON_PARAM, "bob")));
        assertTrue(points.contains(new InjectionPoint("age", InjectionType.JSON_PARAM, "3")));
        assertTrue(points.stream().noneMatch(p -> p.name().equals("nested")));
    }

    @Test
    void form_bodies_yield_body_params() {
        TrafficContext post = TrafficContext.builder("https://a.example.com/login")
                .method("POST")
                .requestHeader("Content-Type", "application/x-www-form-urlencoded")
                .requestBody("user=alice&pass=s%3Dcret")
                .build();

        List<InjectionPoint> points = InjectionPoints.extract(post);

        assertTrue(points.contains(new InjectionPoint("user", InjectionType.BODY_PARAM, "alice")));
        assertTrue(points.contains(new InjectionPoint("pass", InjectionType.BODY_PARAM, "s=cret")));
    }

    @Test
    void injection_clears_the_response_and_assigns_a_new_request_id() {
        TrafficContext probe = new InjectionPoint("id", InjectionType.URL_PARAM, "5").inject(get(), "1' OR");

        assertEquals("https://a.example.com/api/users?id=1'%20OR&q=hi%20there", probe.getUrl());
        assertNotEquals("base-1", probe.getRequestId());
        assertEquals(0, probe.getStatusCode());
        assertTrue(probe.getResponseBody().isEmpty());
        assertTrue(probe.getResponseHeaders().isEmpty());
        assertEquals("sid=abc; theme=dark", probe.requestHeader("Cookie"));
    }

    @Test
    void missing_url_param_is_appended() {
        TrafficContext probe = new InjectionPoint("debug", InjectionType.URL_PARAM, "").inject(get(), "1");
        assertEquals("https://a.example.com/api/users?id=5&q=hi%20there&debug=1", probe.getUrl());
    }

    @Test
    void json_injection_replaces_the_field_value() {
        TrafficContext probe = new InjectionPoint("name", InjectionType.JSON_PARAM, "bob").inject(jsonPost(), "x");
        assertEquals("{\"name\":\"x\",\"age\":3,\"nested\":{\"a\":1}}", probe.getRequestBody());
    }

    @Test
    void cookie_injection_keeps_other_cookies_and_does_not_split_on_semicolons() {
        TrafficContext probe = new InjectionPoint("sid", InjectionType.COOKIE, "abc").inject(get(), "x;id");
        assertEquals("sid=x;id; theme=dark", probe.requestHeader("Cookie"));
    }

    @Test
    void header_injection_adds_absent_headers() {
        TrafficContext probe = new InjectionPoint("User-Agent", InjectionType.HEADER, "").inject(get(), "${7*7}");
        assertEquals("${7*7}", probe.requestHeader("User-Agent"));
        assertEquals("a.example.com", probe.requestHeader("Host"));
    }

    @Test
    void path_injection_replaces_one_segment() {
        TrafficContext probe = new InjectionPoint("1", InjectionType.PATH, "users").inject(get(), "../etc passwd");
        assertEquals("https://a.example.com/api/../etc%20passwd?id=5&q=hi%20there", probe.getUrl());
    }

    @Test
    void encode_escapes_only_syntax_breaking_characters() {
        assertEquals("a%20b%26c%23d%2Be%3Bf", InjectionPoint.encode("a b&c#d+e;f"));
        assertEquals("50%25", InjectionPoint.encode("50%"));
        assertEquals("%2e%2e/", InjectionPoint.encode("%2e%2e/"));
        assertEquals("'<script>", InjectionPoint.encode("'<script>"));
    }
}
