package com.example.craftscore.exception;

public class ReviewNotFoundException extends RuntimeException {

    public ReviewNotFoundException(String reviewId) {
        super("Review request not found: " + reviewId);
    }
}
