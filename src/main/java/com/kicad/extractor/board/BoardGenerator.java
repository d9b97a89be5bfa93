package com.kicad.extractor.board;

import java.io.IOException;

/**
 * Materializes a board artifact from components, nets and footprints.
 */
public interface BoardGenerator {

    BoardFormat format();

    BoardResult generate(BoardRequest request) throws IOException;
}
