package ru.oparin.dream.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;
import ru.oparin.dream.model.enums.JobStatus;

/**
 * Задача существует, но еще не завершена.
 */
@Getter
public class ResultNotReadyException extends RuntimeException {

    private final HttpStatus status = HttpStatus.NOT_FOUND;
    private final String jobId;
    private final JobStatus jobStatus;

    public ResultNotReadyException(String jobId, JobStatus jobStatus) {
        super("Результат задачи " + jobId + " еще не готов, статус: " + jobStatus);
        this.jobId = jobId;
        this.jobStatus = jobStatus;
    }
}
