package com.kicad.extractor.board;

/**
 * Kind of board artifact to produce.
 */
public enum BoardFormat {
    /**
     * Plain-text summary of components, nets and footprints.
     */
    TEXT("ai_generated_board.txt"),

    /**
     * KiCad board file with outline, nets and unrouted footprints.
     */
    KICAD_PCB("ai_generated_board.kicad_pcb");

    private final String fileName;

    BoardFormat(String fileName) {
        this.fileName = fileName;
    }

    public String getFileName() {
        return fileName;
    }
}
