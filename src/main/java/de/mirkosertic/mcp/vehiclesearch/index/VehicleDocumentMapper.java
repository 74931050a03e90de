package de.mirkosertic.mcp.vehiclesearch.index;

import de.mirkosertic.mcp.vehiclesearch.KeywordFoldingAnalyzer;
import de.mirkosertic.mcp.vehiclesearch.model.Vehicle;
import de.mirkosertic.mcp.vehiclesearch.model.VehicleField;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.LongPoint;
import org.apache.lucene.document.NumericDocValuesField;
import org.apache.lucene.document.SortedDocValuesField;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.StringField;
import org.apache.lucene.document.TextField;
import org.apache.lucene.facet.FacetsConfig;
import org.apache.lucene.facet.sortedset.SortedSetDocValuesFacetField;
import org.apache.lucene.index.IndexableField;
import org.apache.lucene.util.BytesRef;

import java.io.IOException;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;

/**
 * Maps vehicles to Lucene documents and back.
 */
public class VehicleDocumentMapper {

    /**
     * Schema version for the index.
     * MUST be incremented whenever the index schema changes (fields added/removed/modified, analyzers changed, etc.).
     */
    public static final int SCHEMA_VERSION = 1;

    public static final String FIELD_ID = "id";
    public static final String FIELD_SEARCH_VECTOR = "search_vector";
    public static final String FIELD_MANUFACTURE_YEAR = VehicleField.YEAR.indexField();
    public static final String FIELD_PRICE = VehicleField.PRICE.indexField();
    public static final String FIELD_CREATED_AT = "created_at";

    private static final String KEY_SUFFIX = "_key";

    private static final List<VehicleField> TEXT_FIELDS = Arrays.stream(VehicleField.values())
            .filter(f -> f.kind() == VehicleField.Kind.TEXT)
            .toList();

    private final KeywordFoldingAnalyzer foldingAnalyzer;
    private final FacetsConfig facetsConfig;

    public VehicleDocumentMapper(final KeywordFoldingAnalyzer foldingAnalyzer) {
        this.foldingAnalyzer = foldingAnalyzer;
        this.facetsConfig = new FacetsConfig();
    }

    public FacetsConfig getFacetsConfig() {
        return facetsConfig;
    }

    /**
     * Name of the folded keyword field used for equality and membership on a text attribute.
     */
    public static String keyField(final VehicleField field) {
        return field.indexField() + KEY_SUFFIX;
    }

    /**
     * Scales a fixed-point value to the long stored in the index.
     */
    public static long toIndexed(final VehicleField field, final BigDecimal value) {
        return value.movePointRight(field.scale()).longValueExact();
    }

    /**
     * Builds the complete document for one vehicle, facet fields already translated,
     * ready for {@code IndexWriter.updateDocument}.
     */
    public Document createDocument(final Vehicle vehicle) throws IOException {
        final Document doc = new Document();

        doc.add(new StringField(FIELD_ID, vehicle.id(), Field.Store.YES));
        doc.add(new SortedDocValuesField(FIELD_ID, new BytesRef(vehicle.id())));

        for (final VehicleField field : TEXT_FIELDS) {
            final String raw = textValue(vehicle, field);
            doc.add(new StringField(keyField(field), foldingAnalyzer.fold(keyField(field), raw), Field.Store.NO));
            doc.add(new StoredField(field.indexField(), raw));
            doc.add(new SortedSetDocValuesFacetField(field.indexField(), raw));
        }

        addLong(doc, FIELD_MANUFACTURE_YEAR, vehicle.manufactureYear());
        addLong(doc, VehicleField.MODEL_YEAR.indexField(), vehicle.modelYear());
        addLong(doc, FIELD_PRICE, toIndexed(VehicleField.PRICE, vehicle.price()));
        addLong(doc, VehicleField.MILEAGE.indexField(), vehicle.mileage());
        addLong(doc, VehicleField.DOORS.indexField(), vehicle.doors());
        addLong(doc, VehicleField.ENGINE_SIZE.indexField(), toIndexed(VehicleField.ENGINE_SIZE, vehicle.engineSize()));
        addLong(doc, FIELD_CREATED_AT, vehicle.createdAt().toEpochMilli());

        doc.add(new TextField(FIELD_SEARCH_VECTOR, SearchVector.sourceText(vehicle), Field.Store.NO));

        return facetsConfig.build(doc);
    }

    public Vehicle toVehicle(final Document stored) {
        return new Vehicle(
                stored.get(FIELD_ID),
                stored.get(VehicleField.BRAND.indexField()),
                stored.get(VehicleField.MODEL.indexField()),
                (int) longValue(stored, FIELD_MANUFACTURE_YEAR),
                (int) longValue(stored, VehicleField.MODEL_YEAR.indexField()),
                BigDecimal.valueOf(longValue(stored, VehicleField.ENGINE_SIZE.indexField()), VehicleField.ENGINE_SIZE.scale()),
                stored.get(VehicleField.FUEL_TYPE.indexField()),
                stored.get(VehicleField.COLOR.indexField()),
                (int) longValue(stored, VehicleField.MILEAGE.indexField()),
                (int) longValue(stored, VehicleField.DOORS.indexField()),
                stored.get(VehicleField.TRANSMISSION.indexField()),
                BigDecimal.valueOf(longValue(stored, FIELD_PRICE), VehicleField.PRICE.scale()),
                Instant.ofEpochMilli(longValue(stored, FIELD_CREATED_AT)));
    }

    private static void addLong(final Document doc, final String name, final long value) {
        doc.add(new LongPoint(name, value));
        doc.add(new NumericDocValuesField(name, value));
        doc.add(new StoredField(name, value));
    }

    private static long longValue(final Document stored, final String name) {
        final IndexableField field = stored.getField(name);
        if (field == null || field.numericValue() == null) {
            throw new IllegalStateException("Stored document lacks numeric field " + name);
        }
        return field.numericValue().longValue();
    }

    private static String textValue(final Vehicle vehicle, final VehicleField field) {
        return switch (field) {
            case BRAND -> vehicle.brand();
            case MODEL -> vehicle.model();
            case FUEL_TYPE -> vehicle.fuelType();
            case COLOR -> vehicle.color();
            case TRANSMISSION -> vehicle.transmission();
            default -> throw new IllegalArgumentException("Not a text field: " + field);
        };
    }
}
