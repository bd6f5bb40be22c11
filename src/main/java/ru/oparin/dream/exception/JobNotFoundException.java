package ru.oparin.dream.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public class JobNotFoundException extends RuntimeException {

    private final HttpStatus status = HttpStatus.NOT_FOUND;
    private final String jobId;

    public JobNotFoundException(String jobId) {
        super("Задача не найдена: " + jobId);
        this.jobId = jobId;
    }
}
