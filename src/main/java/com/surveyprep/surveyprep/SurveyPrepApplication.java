package com.surveyprep.surveyprep;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SurveyPrepApplication {

    public static void main(String[] args) {
        SpringApplication.run(SurveyPrepApplication.class, args);
    }
}
