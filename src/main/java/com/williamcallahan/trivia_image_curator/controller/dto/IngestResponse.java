package com.williamcallahan.trivia_image_curator.controller.dto;

public record IngestResponse(String publicUrl) {
}
