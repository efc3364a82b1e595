package io.pagekeys.identifier;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class SnakeCaseTest {

    @Test
    void splitsOnAsciiCaseBoundaries() {
        Assertions.assertEquals("my_page", SnakeCase.of("MyPage"));
        Assertions.assertEquals("http_server", SnakeCase.of("HTTPServer"));
        Assertions.assertEquals("xml_http_request", SnakeCase.of("XMLHttpRequest"));
        Assertions.assertEquals("abc", SnakeCase.of("ABC"));
        Assertions.assertEquals("a_b", SnakeCase.of("aB"));
    }

    @Test
    void collapsesDelimiterRuns() {
        Assertions.assertEquals("hello_world", SnakeCase.of("Hello World"));
        Assertions.assertEquals("a_b", SnakeCase.of("a - b"));
        Assertions.assertEquals("already_snake", SnakeCase.of("already_snake"));
    }

    @Test
    void leavesNonAsciiLettersAlone() {
        Assertions.assertEquals("东京", SnakeCase.of("东京"));
        Assertions.assertEquals("Ünter", SnakeCase.of("Ünter"));
        Assertions.assertEquals("", SnakeCase.of(""));
    }
}
