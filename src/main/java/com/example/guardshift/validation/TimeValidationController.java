package com.example.guardshift.validation;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class TimeValidationController {

    private final TimeGridValidator validator;

    public TimeValidationController(TimeGridValidator validator) {
        this.validator = validator;
    }

    @GetMapping({"/validate-time/{time}", "/api/validate-time/{time}"})
    public ResponseEntity<TimeValidationResponse> validateTime(@PathVariable("time") String time) {
        return ResponseEntity.ok(validator.validate(time));
    }
}
