package com.codefarm.shorturl.web;

import com.codefarm.shorturl.config.ShortenerProperties;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.web.bind.annotation.GetMapping;

@Controller
public class UrlWebController {

    private static final String VIEW_INDEX = "index";

    private final BaseUrlResolver baseUrlResolver;
    private final ShortenerProperties properties;

    public UrlWebController(BaseUrlResolver baseUrlResolver, ShortenerProperties properties) {
        this.baseUrlResolver = baseUrlResolver;
        this.properties = properties;
    }

    @GetMapping("/")
    public String index(HttpServletRequest request, Model model) {
        model.addAttribute("baseUrl", baseUrlResolver.resolve(request));
        model.addAttribute("serviceName", properties.getServiceName());
        model.addAttribute("version", properties.getVersion());
        return VIEW_INDEX;
    }
}
