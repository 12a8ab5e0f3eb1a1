package io.github.drompincen.boardpilot.persistence.document;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

@Document(collection = "lanes")
@CompoundIndex(name = "board_lane_number", def = "{'boardId': 1, 'laneNumber': 1}", unique = true)
public class LaneDocument {

    @Id
    private String laneId;
    private String boardId;
    private int laneNumber;
    private String name;

    public LaneDocument() {}

    public String getLaneId() { return laneId; }
    public void setLaneId(String laneId) { this.laneId = laneId; }

    public String getBoardId() { return boardId; }
    public void setBoardId(String boardId) { this.boardId = boardId; }

    public int getLaneNumber() { return laneNumber; }
    public void setLaneNumber(int laneNumber) { this.laneNumber = laneNumber; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
}
