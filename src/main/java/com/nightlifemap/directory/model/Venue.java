package com.nightlifemap.directory.model;

import com.nightlifemap.directory.util.DirectoryKeyFactory;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbIgnore;

import java.util.Optional;

/**
 * Venue entity for the DirectoryTable, reduced to what grid placement reads and writes.
 *
 * Key Patterns:
 * - PK = VENUE#{venueId}, SK = METADATA
 *
 * GSI (ZoneCellIndex):
 * - gsi1pk = ZONE#{zone}
 * - gsi1sk = CELL#{row}#{col} while placed, otherwise the placement state (DETACHED / UNPLACED)
 *
 * A venue always belongs to a zone. Its row and column are both set or both absent.
 */
@DynamoDbBean
public class Venue extends BaseItem {

    private String venueId;
    private String name;
    private String zone;
    private Integer gridRow;
    private Integer gridCol;
    private String placementState;

    // Default constructor for DynamoDB
    public Venue() {
        super();
        setItemType(DirectoryKeyFactory.VENUE_PREFIX);
    }

    public Venue(String venueId, String name, GridCell cell) {
        this();
        this.venueId = venueId;
        this.name = name;
        setPk(DirectoryKeyFactory.getVenuePk(venueId));
        setSk(DirectoryKeyFactory.getMetadataSk());
        placeAt(cell);
    }

    /**
     * Create a venue that belongs to a zone but has no cell yet.
     */
    public static Venue unplaced(String venueId, String name, String zone) {
        Venue venue = new Venue();
        venue.venueId = venueId;
        venue.name = name;
        venue.setPk(DirectoryKeyFactory.getVenuePk(venueId));
        venue.setSk(DirectoryKeyFactory.getMetadataSk());
        venue.clearCell(zone, DirectoryKeyFactory.STATE_UNPLACED);
        return venue;
    }

    /**
     * Copy with the same identity and timestamps.
     */
    public Venue copy() {
        Venue copy = new Venue();
        copy.setPk(getPk());
        copy.setSk(getSk());
        copy.setGsi1pk(getGsi1pk());
        copy.setGsi1sk(getGsi1sk());
        copy.setCreatedAt(getCreatedAt());
        copy.setUpdatedAt(getUpdatedAt());
        copy.venueId = venueId;
        copy.name = name;
        copy.zone = zone;
        copy.gridRow = gridRow;
        copy.gridCol = gridCol;
        copy.placementState = placementState;
        return copy;
    }

    /**
     * Put the venue in a cell, keeping the GSI keys in step.
     */
    public void placeAt(GridCell cell) {
        this.zone = cell.zone();
        this.gridRow = cell.row();
        this.gridCol = cell.col();
        this.placementState = DirectoryKeyFactory.STATE_PLACED;
        setGsi1pk(DirectoryKeyFactory.getZoneGsi1Pk(cell.zone()));
        setGsi1sk(DirectoryKeyFactory.getCellGsi1Sk(cell.row(), cell.col()));
        touch();
    }

    /**
     * Remove the venue's cell while leaving it listed under its zone.
     */
    public void detach() {
        clearCell(zone, DirectoryKeyFactory.STATE_DETACHED);
    }

    /**
     * Remove the venue's cell and list it, never placed, under {@code zone}.
     */
    public void unplace(String zone) {
        clearCell(zone, DirectoryKeyFactory.STATE_UNPLACED);
    }

    private void clearCell(String zone, String state) {
        this.zone = zone;
        this.gridRow = null;
        this.gridCol = null;
        this.placementState = state;
        setGsi1pk(DirectoryKeyFactory.getZoneGsi1Pk(zone));
        setGsi1sk(state);
        touch();
    }

    @DynamoDbIgnore
    public Optional<GridCell> getCell() {
        if (gridRow == null || gridCol == null) {
            return Optional.empty();
        }
        return Optional.of(new GridCell(zone, gridRow, gridCol));
    }

    @DynamoDbIgnore
    public boolean isPlaced() {
        return gridRow != null && gridCol != null;
    }

    public String getVenueId() {
        return venueId;
    }

    public void setVenueId(String venueId) {
        this.venueId = venueId;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getZone() {
        return zone;
    }

    public void setZone(String zone) {
        this.zone = zone;
    }

    public Integer getGridRow() {
        return gridRow;
    }

    public void setGridRow(Integer gridRow) {
        this.gridRow = gridRow;
    }

    public Integer getGridCol() {
        return gridCol;
    }

    public void setGridCol(Integer gridCol) {
        this.gridCol = gridCol;
    }

    public String getPlacementState() {
        return placementState;
    }

    public void setPlacementState(String placementState) {
        this.placementState = placementState;
    }
}
