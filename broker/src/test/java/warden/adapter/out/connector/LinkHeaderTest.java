package warden.adapter.out.connector;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("LinkHeader")
class LinkHeaderTest {

    private static final String HEADER = "<https://gitlab.example.com/api/v4/groups?page=2>; rel=\"next\", "
            + "<https://gitlab.example.com/api/v4/groups?page=1>; rel=\"first\", "
            + "<https://gitlab.example.com/api/v4/groups?page=5>; rel=\"last\"";

    @Test
    @DisplayName("should extract next and last links")
    void nextAndLast() {
        assertEquals(Optional.of("https://gitlab.example.com/api/v4/groups?page=2"), LinkHeader.next(HEADER));
        assertEquals(Optional.of("https://gitlab.example.com/api/v4/groups?page=5"), LinkHeader.last(HEADER));
    }

    @Test
    @DisplayName("should return empty when a relation is missing")
    void missingRelation() {
        var header = "<https://gitlab.example.com/api/v4/groups?page=1>; rel=\"first\"";

        assertTrue(LinkHeader.next(header).isEmpty());
        assertTrue(LinkHeader.last(header).isEmpty());
    }

    @Test
    @DisplayName("should tolerate a missing header")
    void nullHeader() {
        assertTrue(LinkHeader.next(null).isEmpty());
        assertTrue(LinkHeader.last(null).isEmpty());
    }
}
