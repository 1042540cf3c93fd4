package eu.virtualparadox.articlefinder;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ArticleFinderApplication {

    public static void main(String[] args) {
        SpringApplication.run(ArticleFinderApplication.class, args);
    }
}
