package com.project.sketch.scoring.exceptions;

import com.project.sketch.scoring.controller.ScoringFormModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ui.Model;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

import jakarta.validation.ConstraintViolationException;
import java.io.IOException;

/**
 * Error handling for the browser pages: the message goes onto the model and the form is shown
 * again with its options. The JSON API has its own handler, {@link ApiExceptionHandler}.
 */
@ControllerAdvice
public class GlobalExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private final ScoringFormModel formModel;

    public GlobalExceptionHandler(ScoringFormModel formModel) {
        this.formModel = formModel;
    }

    @ExceptionHandler({StorageException.class, ScoringException.class})
    public String handleDomainExceptions(RuntimeException ex, Model model) {
        log.warn("Domain error: {}", ex.getMessage());
        return form(model, ex.getMessage());
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public String handleMaxUploadSizeExceeded(MaxUploadSizeExceededException ex, Model model) {
        log.warn("File upload size exceeded: {}", ex.getMessage());
        return form(model, "Файлът е твърде голям. Максимален размер: 10MB");
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public String handleValidationErrors(ConstraintViolationException ex, Model model) {
        log.warn("Validation error: {}", ex.getMessage());
        return form(model, "Невалидни параметри. Моля проверете въведените данни.");
    }

    @ExceptionHandler(IOException.class)
    public String handleIOException(IOException ex, Model model) {
        log.error("IO error occurred", ex);
        return form(model, "Грешка при обработката на файла. Моля опитайте с друго изображение.");
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public String handleIllegalArgument(IllegalArgumentException ex, Model model) {
        log.warn("Invalid argument: {}", ex.getMessage());
        return form(model, "Невалидни параметри: " + ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public String handleUnknownException(Exception ex, Model model) {
        log.error("Unhandled error occurred", ex);
        // началната страница също показва трудностите
        formModel.populate(model);
        model.addAttribute("error", "Възникна неочаквана грешка. Моля опитайте отново или се свържете с администратора.");
        return "index";
    }

    private String form(Model model, String error) {
        formModel.populate(model);
        model.addAttribute("error", error);
        return "score";
    }
}
