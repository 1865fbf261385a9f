package uitrace.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Integer screen coordinates, used for click points and rectangle centers.
 */
public record Point(@JsonProperty("x") int x, @JsonProperty("y") int y) {

    @Override
    public String toString() {
        return "(" + x + ", " + y + ")";
    }
}
