package org.wingshape.io.csv;

/**
 * Describes which header columns carry the specimen metadata.
 * Example header:
 * image_id,species,gender,a1,...,a10,b1,...,d10
 *
 * @param speciesColumn required species column
 * @param sexColumn required sex column
 * @param idColumn optional identifier column; when null or absent from the file, ids are "row-N"
 */
public record CsvFormat(String speciesColumn, String sexColumn, String idColumn) {

    public static final String DEFAULT_SPECIES_COLUMN = "species";
    public static final String DEFAULT_SEX_COLUMN = "gender";
    public static final String DEFAULT_ID_COLUMN = "image_id";

    public CsvFormat {
        if (speciesColumn == null || speciesColumn.isBlank()) {
            throw new IllegalArgumentException("speciesColumn must be non-empty");
        }
        if (sexColumn == null || sexColumn.isBlank()) {
            throw new IllegalArgumentException("sexColumn must be non-empty");
        }
        if (idColumn != null && idColumn.isBlank()) {
            idColumn = null;
        }
    }

    public static CsvFormat defaults() {
        return new CsvFormat(DEFAULT_SPECIES_COLUMN, DEFAULT_SEX_COLUMN, DEFAULT_ID_COLUMN);
    }
}
