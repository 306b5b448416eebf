package Model;

import java.util.Optional;

@FunctionalInterface
public interface UniqueColorSource {

    /** Empty when the file cannot be decoded. */
    Optional<Integer> uniqueColors(String filePath);
}
