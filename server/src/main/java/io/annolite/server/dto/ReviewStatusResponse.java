// file: server/src/main/java/io/annolite/server/dto/ReviewStatusResponse.java
package io.annolite.server.dto;

public class ReviewStatusResponse {
    public boolean done;
    public boolean inkFound;
    public String lastUpdated; // ISO-8601
}
