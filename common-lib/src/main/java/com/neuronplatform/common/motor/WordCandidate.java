package com.neuronplatform.common.motor;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One (surface form, originating node) option for the motor walk. The score is mutable:
 * the walk halves it for siblings of each chosen word.
 */
public class WordCandidate {

    private final String       word;
    private final String       nodeId;
    private final double       activation;
    private final PartOfSpeech pos;

    private double score;
    private String reason = "";

    public WordCandidate(String word, String nodeId, double activation, PartOfSpeech pos) {
        this.word       = word;
        this.nodeId     = nodeId;
        this.activation = activation;
        this.pos        = pos;
    }

    @JsonProperty("word")       public String       getWord()       { return word; }
    @JsonProperty("nodeId")     public String       getNodeId()     { return nodeId; }
    @JsonProperty("activation") public double       getActivation() { return activation; }
    @JsonProperty("pos")        public PartOfSpeech getPos()        { return pos; }
    @JsonProperty("score")      public double       getScore()      { return score; }
    @JsonProperty("reason")     public String       getReason()     { return reason; }

    public void setScore(double score) {
        this.score = score;
    }

    public void setReason(String reason) {
        this.reason = reason;
    }

    @Override
    public String toString() {
        return String.format("'%s' pos=%s score=%.3f", word, pos.tag(), score);
    }
}
