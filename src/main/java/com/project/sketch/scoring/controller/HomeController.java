package com.project.sketch.scoring.controller;

import com.project.sketch.scoring.service.CuratedReferenceCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.web.bind.annotation.GetMapping;

/**
 * Serves the home page. Thin controller: just routes to a Thymeleaf view.
 */
@Controller
public class HomeController {
    private static final Logger log = LoggerFactory.getLogger(HomeController.class);

    private final CuratedReferenceCatalog catalog;

    public HomeController(CuratedReferenceCatalog catalog) {
        this.catalog = catalog;
    }

    @GetMapping("/")
    public String index(Model model) {
        log.debug("Serving home page");
        model.addAttribute("difficulties", catalog.difficulties());
        return "index"; // templates/index.html
    }
}
